package me.golemcore.orchestrator.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Todo list after an update together with its progress counters.
 */
@Value
@Builder
public class TodoUpdateResult {

    List<Todo> todos;
    int completed;
    int inProgress;
    int total;
    String message;

    public static TodoUpdateResult of(List<Todo> todos) {
        int completed = (int) todos.stream().filter(Todo::isCompleted).count();
        int inProgress = (int) todos.stream().filter(Todo::isInProgress).count();
        return TodoUpdateResult.builder()
                .todos(todos)
                .completed(completed)
                .inProgress(inProgress)
                .total(todos.size())
                .message("Todos updated: " + completed + "/" + todos.size() + " completed, "
                        + inProgress + " in progress")
                .build();
    }
}
