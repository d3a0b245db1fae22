package me.golemcore.orchestrator.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Status change reported by a child task.
 */
@Value
@Builder
public class SubtaskNotification {

    String taskId;
    String title;
    String status;
    String message;
}
