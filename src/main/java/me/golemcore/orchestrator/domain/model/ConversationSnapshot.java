package me.golemcore.orchestrator.domain.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Read-only export of a conversation with events sorted by sequence number.
 */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ConversationSnapshot {

    private static final Comparator<ResponseEvent> BY_SEQUENCE = Comparator.comparingLong(
            event -> event.getSequenceNumber() != null ? event.getSequenceNumber() : 0L);

    List<ResponseEvent> events;
    List<Message> messages;
    String taskId;
    String agentId;
    String lastResponseId;
    boolean initialized;
    ConversationPhase phase;
    List<String> pendingApprovals;
    List<Todo> todos;
    List<Subtask> subtasks;

    public static ConversationSnapshot of(ConversationState state) {
        List<ResponseEvent> sorted = new ArrayList<>(state.getEvents());
        sorted.sort(BY_SEQUENCE);
        return ConversationSnapshot.builder()
                .events(List.copyOf(sorted))
                .messages(state.getMessages())
                .taskId(state.getTaskId())
                .agentId(state.getAgentId())
                .lastResponseId(state.getLastResponseId())
                .initialized(state.isInitialized())
                .phase(state.getPhase())
                .pendingApprovals(List.copyOf(state.getPendingApprovals().keySet()))
                .todos(state.getTodos())
                .subtasks(List.copyOf(state.getSubtasks().values()))
                .build();
    }
}
