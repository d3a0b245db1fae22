package me.golemcore.orchestrator.domain.exception;

/**
 * The caller thread was interrupted while waiting for initialization. The
 * interrupt flag is restored before this is thrown.
 */
public class InitializationInterruptedException extends OrchestratorException {

    public InitializationInterruptedException(String taskId, InterruptedException cause) {
        super("Interrupted while waiting for conversation " + taskId + " to initialize", cause);
    }
}
