package me.golemcore.orchestrator.domain.exception;

/**
 * A task id is already bound to a conversation of a different agent.
 */
public class TaskOwnershipConflictException extends OrchestratorException {

    public TaskOwnershipConflictException(String taskId, String ownerAgentId) {
        super("Task " + taskId + " belongs to agent " + ownerAgentId);
    }
}
