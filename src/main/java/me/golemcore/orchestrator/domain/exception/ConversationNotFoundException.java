package me.golemcore.orchestrator.domain.exception;

/**
 * No conversation is registered for the given task id.
 */
public class ConversationNotFoundException extends OrchestratorException {

    public ConversationNotFoundException(String taskId) {
        super("Conversation not found: " + taskId);
    }
}
