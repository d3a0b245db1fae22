package me.golemcore.orchestrator.domain.exception;

/**
 * A mutation was submitted to a conversation that has already ended.
 */
public class ConversationEndedException extends OrchestratorException {

    public ConversationEndedException(String taskId) {
        super("Conversation " + taskId + " has ended");
    }
}
