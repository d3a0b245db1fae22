package me.golemcore.orchestrator.domain.exception;

/**
 * Agent or tool configuration could not be loaded for a conversation.
 */
public class InitializationFailedException extends OrchestratorException {

    public InitializationFailedException(String message) {
        super(message);
    }

    public InitializationFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
