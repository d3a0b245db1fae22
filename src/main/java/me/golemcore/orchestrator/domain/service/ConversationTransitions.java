package me.golemcore.orchestrator.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.orchestrator.domain.model.ApprovalRequest;
import me.golemcore.orchestrator.domain.model.ConversationPhase;
import me.golemcore.orchestrator.domain.model.ConversationState;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.domain.model.ModelConfig;
import me.golemcore.orchestrator.domain.model.ResponseEvent;
import me.golemcore.orchestrator.domain.model.Subtask;
import me.golemcore.orchestrator.domain.model.SubtaskNotification;
import me.golemcore.orchestrator.domain.model.Todo;
import me.golemcore.orchestrator.domain.model.TodoUpdateResult;
import me.golemcore.orchestrator.domain.model.ToolDescriptor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Pure state transitions of a conversation.
 *
 * <p>
 * Each function takes the current {@link ConversationState} and returns the
 * next one without touching the input. Callers serialize their application on
 * the conversation actor.
 */
public final class ConversationTransitions {

    private static final String CALL_SCOPE_PREFIX = "call-";

    private ConversationTransitions() {
    }

    public static ConversationState beginInitialization(ConversationState state) {
        if (state.getPhase() != ConversationPhase.UNINITIALIZED) {
            return state;
        }
        return state.toBuilder().phase(ConversationPhase.INITIALIZING).build();
    }

    /**
     * Stores model and tool configuration, appends the preamble messages and
     * moves to {@link ConversationPhase#READY}. Applied once; a second call is
     * a no-op so configuration is never reloaded.
     */
    public static ConversationState completeInitialization(ConversationState state, ModelConfig modelConfig,
            List<ToolDescriptor> toolConfig, List<Message> preamble) {
        if (state.isInitialized() || state.isEnded()) {
            return state;
        }
        return state.toBuilder()
                .modelConfig(modelConfig)
                .toolConfig(List.copyOf(toolConfig))
                .messages(concat(state.getMessages(), preamble))
                .initialized(true)
                .phase(ConversationPhase.READY)
                .build();
    }

    public static ConversationState appendMessages(ConversationState state, List<Message> batch) {
        if (batch == null || batch.isEmpty()) {
            return state;
        }
        return state.toBuilder().messages(concat(state.getMessages(), batch)).build();
    }

    /**
     * Enters {@link ConversationPhase#PROCESSING} for one LLM call. Upstream
     * sequence numbers of this call are offset past everything already
     * persisted, and fallback ids are scoped to this call.
     */
    public static ConversationState beginCall(ConversationState state) {
        if (state.isEnded()) {
            return state;
        }
        int call = state.getCallCount() + 1;
        return state.toBuilder()
                .phase(ConversationPhase.PROCESSING)
                .sequenceBase(state.nextLocalSequence())
                .callCount(call)
                .callScope(CALL_SCOPE_PREFIX + call)
                .build();
    }

    /**
     * Switches the fallback id scope of the call in progress to its response
     * id. Outside a call this is a no-op.
     */
    public static ConversationState enterResponseScope(ConversationState state, String responseId) {
        if (responseId == null || state.getPhase() != ConversationPhase.PROCESSING
                || responseId.equals(state.getCallScope())) {
            return state;
        }
        return state.toBuilder().callScope(responseId).build();
    }

    public static ConversationState finishCall(ConversationState state) {
        if (state.getPhase() != ConversationPhase.PROCESSING) {
            return state;
        }
        return state.toBuilder().phase(ConversationPhase.READY).build();
    }

    /**
     * Appends an event that already carries its final id and sequence number.
     */
    public static ConversationState appendEvent(ConversationState state, ResponseEvent event) {
        Set<String> ids = new HashSet<>(state.getEventIds());
        ids.add(event.getId());
        long sequence = event.getSequenceNumber() != null ? event.getSequenceNumber() : state.nextLocalSequence();
        return state.toBuilder()
                .events(concat(state.getEvents(), List.of(event)))
                .eventIds(Collections.unmodifiableSet(ids))
                .maxSequenceNumber(Math.max(state.getMaxSequenceNumber(), sequence))
                .build();
    }

    /**
     * Sets the continuation token. Setting the current value returns the same
     * state.
     */
    public static ConversationState updateLastResponseId(ConversationState state, String responseId) {
        if (responseId == null || Objects.equals(responseId, state.getLastResponseId())) {
            return state;
        }
        return state.toBuilder()
                .lastResponseId(responseId)
                .responseIndex(state.getResponseIndex() + 1)
                .build();
    }

    public static ConversationState registerApproval(ConversationState state, ApprovalRequest request) {
        if (state.getPendingApprovals().containsKey(request.getId())) {
            return state;
        }
        Map<String, ApprovalRequest> pending = new LinkedHashMap<>(state.getPendingApprovals());
        pending.put(request.getId(), request);
        return state.toBuilder().pendingApprovals(Collections.unmodifiableMap(pending)).build();
    }

    public static ConversationState rememberAssistantItem(ConversationState state, String itemId) {
        if (itemId == null) {
            return state;
        }
        Set<String> ids = new HashSet<>(state.getAssistantItemIds());
        ids.add(itemId);
        return state.toBuilder().assistantItemIds(Collections.unmodifiableSet(ids)).build();
    }

    /**
     * Removes a pending approval and moves its waiting event to
     * {@code completed} (approved) or {@code failed} (denied). Unknown ids
     * leave the state untouched.
     */
    public static ConversationState resolveApproval(ConversationState state, String approvalId, boolean approved) {
        if (!state.getPendingApprovals().containsKey(approvalId)) {
            return state;
        }
        Map<String, ApprovalRequest> pending = new LinkedHashMap<>(state.getPendingApprovals());
        pending.remove(approvalId);

        String terminalStatus = approved ? ResponseEvent.STATUS_COMPLETED : ResponseEvent.STATUS_FAILED;
        List<ResponseEvent> events = new ArrayList<>(state.getEvents().size());
        for (ResponseEvent event : state.getEvents()) {
            if (approvalId.equals(event.getItemId())
                    && ResponseEvent.STATUS_WAITING_APPROVAL.equals(event.getStatus())) {
                events.add(event.withStatus(terminalStatus));
            } else {
                events.add(event);
            }
        }
        return state.toBuilder()
                .pendingApprovals(Collections.unmodifiableMap(pending))
                .events(Collections.unmodifiableList(events))
                .build();
    }

    /**
     * Replaces the todo list. Entries are keyed by id, a repeated id keeps the
     * first position and the last content. A non-empty list also appends a
     * developer message with the progress so the model sees it on the next
     * call.
     */
    public static ConversationState replaceTodos(ConversationState state, List<Todo> todos) {
        Map<String, Todo> byId = new LinkedHashMap<>();
        for (Todo todo : todos) {
            byId.put(todo.getId(), todo);
        }
        List<Todo> replaced = List.copyOf(byId.values());
        ConversationState next = state.toBuilder().todos(replaced).build();
        if (replaced.isEmpty()) {
            return next;
        }
        return appendMessages(next, List.of(Message.developer(formatTodoProgress(replaced))));
    }

    public static ConversationState registerSubtask(ConversationState state, Subtask subtask) {
        Map<String, Subtask> subtasks = new LinkedHashMap<>(state.getSubtasks());
        subtasks.put(subtask.getTaskId(), subtask);
        return state.toBuilder().subtasks(Collections.unmodifiableMap(subtasks)).build();
    }

    /**
     * Applies a child task's status. A failure also records its message.
     * Unknown child tasks leave the state untouched.
     */
    public static ConversationState applySubtaskStatus(ConversationState state, SubtaskNotification notification) {
        Subtask current = state.getSubtasks().get(notification.getTaskId());
        if (current == null) {
            return state;
        }
        Subtask.SubtaskBuilder updated = current.toBuilder().status(notification.getStatus());
        if (Subtask.STATUS_FAILED.equals(notification.getStatus())) {
            updated.error(notification.getMessage());
        }
        return registerSubtask(state, updated.build());
    }

    public static ConversationState end(ConversationState state) {
        if (state.isEnded()) {
            return state;
        }
        return state.toBuilder().ended(true).phase(ConversationPhase.ENDED).build();
    }

    static String formatTodoProgress(List<Todo> todos) {
        TodoUpdateResult progress = TodoUpdateResult.of(todos);
        StringBuilder text = new StringBuilder()
                .append("Progress: ").append(progress.getCompleted()).append('/').append(progress.getTotal())
                .append(" completed");
        if (progress.getInProgress() > 0) {
            text.append(", ").append(progress.getInProgress()).append(" in progress");
        }
        text.append("\n\n");
        for (Todo todo : todos) {
            text.append(todo.isCompleted() ? "[x] " : "[ ] ").append(todo.getContent()).append('\n');
        }
        text.append("\nUpdate status as you complete steps using updatetodos.");
        return text.toString();
    }

    private static <T> List<T> concat(List<T> head, List<T> tail) {
        List<T> merged = new ArrayList<>(head.size() + tail.size());
        merged.addAll(head);
        merged.addAll(tail);
        return Collections.unmodifiableList(merged);
    }
}
