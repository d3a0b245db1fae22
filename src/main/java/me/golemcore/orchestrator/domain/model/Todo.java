package me.golemcore.orchestrator.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * One entry of the agent's todo list. The agent always sends its full list.
 */
@Value
@Builder
public class Todo {

    public static final String STATUS_IN_PROGRESS = "in_progress";
    public static final String STATUS_COMPLETED = "completed";

    String id;
    String content;
    String status;

    public boolean isCompleted() {
        return STATUS_COMPLETED.equals(status);
    }

    public boolean isInProgress() {
        return STATUS_IN_PROGRESS.equals(status);
    }
}
