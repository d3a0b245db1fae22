package me.golemcore.orchestrator.domain.service;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.ConversationState;
import me.golemcore.orchestrator.domain.model.Subtask;
import me.golemcore.orchestrator.domain.model.SubtaskNotification;
import me.golemcore.orchestrator.domain.model.Todo;
import me.golemcore.orchestrator.domain.model.TodoUpdateResult;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Keeps the agent's todo list and its child tasks in the conversation state.
 * None of these updates call the model.
 */
@Component
@Slf4j
public class TaskProgressHandler {

    public TodoUpdateResult updateTodos(ConversationStateHolder holder, List<Todo> todos) {
        ConversationState next = holder.update(state -> ConversationTransitions.replaceTodos(state, todos));
        TodoUpdateResult result = TodoUpdateResult.of(next.getTodos());
        log.info("[Progress] {}: task={}", result.getMessage(), next.getTaskId());
        return result;
    }

    public Subtask registerSubtask(ConversationStateHolder holder, Subtask subtask) {
        ConversationState next = holder.update(state -> ConversationTransitions.registerSubtask(state, subtask));
        log.info("[Progress] subtask registered: task={}, subtask={}, title={}",
                next.getTaskId(), subtask.getTaskId(), subtask.getTitle());
        return next.getSubtasks().get(subtask.getTaskId());
    }

    public Optional<Subtask> notifySubtask(ConversationStateHolder holder, SubtaskNotification notification) {
        String taskId = holder.current().getTaskId();
        if (!holder.current().getSubtasks().containsKey(notification.getTaskId())) {
            log.warn("[Progress] subtask {} not found: task={}", notification.getTaskId(), taskId);
            return Optional.empty();
        }
        ConversationState next = holder.update(
                state -> ConversationTransitions.applySubtaskStatus(state, notification));
        Subtask updated = next.getSubtasks().get(notification.getTaskId());
        if (Subtask.STATUS_FAILED.equals(updated.getStatus())) {
            log.warn("[Progress] subtask failed: task={}, subtask={}, title={}: {}",
                    taskId, updated.getTaskId(), updated.getTitle(), notification.getMessage());
        } else {
            log.info("[Progress] subtask {} -> {}: task={}", updated.getTaskId(), updated.getStatus(), taskId);
        }
        return Optional.of(updated);
    }
}
