package me.golemcore.orchestrator.domain.exception;

import me.golemcore.orchestrator.domain.model.ErrorSource;

/**
 * A message turn failed. The failure is already recorded as an error event in
 * the conversation log; the rest of the batch was not processed.
 */
public class TurnFailedException extends OrchestratorException {

    private final ErrorSource source;

    public TurnFailedException(ErrorSource source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    public ErrorSource getSource() {
        return source;
    }
}
