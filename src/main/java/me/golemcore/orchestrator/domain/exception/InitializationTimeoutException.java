package me.golemcore.orchestrator.domain.exception;

import java.time.Duration;

/**
 * The conversation did not finish initialization within the allowed wait.
 */
public class InitializationTimeoutException extends OrchestratorException {

    public InitializationTimeoutException(String taskId, Duration timeout) {
        super("Conversation " + taskId + " not initialized within " + timeout.toMillis() + "ms");
    }
}
