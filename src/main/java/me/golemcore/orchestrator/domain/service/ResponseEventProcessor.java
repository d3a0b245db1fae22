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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.ApprovalRequest;
import me.golemcore.orchestrator.domain.model.ConversationPhase;
import me.golemcore.orchestrator.domain.model.ConversationState;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.domain.model.ResponseEvent;
import me.golemcore.orchestrator.domain.model.ResponseEventKind;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Applies one backend stream event to the conversation state.
 *
 * <p>
 * Processing rules:
 * <ul>
 * <li>Delta events are returned for live forwarding and never persisted.</li>
 * <li>Every other event is persisted once, keyed by id; a repeated id is
 * dropped with a warning.</li>
 * <li>Upstream sequence numbers are offset by the current call's sequence
 * base; events without one get the next local number. Outside a call each
 * event is its own scope, based past everything already persisted.</li>
 * <li>Events without an upstream id get {@code scope:sequence} (or
 * {@code scope:type:itemId}), where the scope is the event's own response id,
 * else the call scope.</li>
 * <li>A finalized assistant message becomes an assistant entry in the message
 * log, once per item id.</li>
 * <li>An approval-request item is registered as pending and its event is
 * marked {@code waiting-approval}.</li>
 * <li>{@code response.created} updates the continuation token.</li>
 * </ul>
 *
 * The processor is a pure function of its inputs and performs no I/O.
 *
 * @since 1.0
 */
@Component
@Slf4j
public class ResponseEventProcessor {

    private static final String ITEM_TYPE_MESSAGE = "message";
    private static final String ITEM_TYPE_APPROVAL_REQUEST = "mcp_approval_request";
    private static final String PART_TYPE_OUTPUT_TEXT = "output_text";
    private static final String INGEST_SCOPE_PREFIX = "ingest-";

    public EventTransition process(ConversationState state, ResponseEvent event) {
        if (event.isDelta()) {
            return EventTransition.forward(state, event);
        }

        boolean inCall = state.getPhase() == ConversationPhase.PROCESSING;
        long base = inCall ? state.getSequenceBase() : state.nextLocalSequence();
        String fallbackScope = inCall && state.getCallScope() != null
                ? state.getCallScope()
                : INGEST_SCOPE_PREFIX + base;

        String eventId = resolveEventId(event, fallbackScope);
        if (state.hasEvent(eventId)) {
            log.warn("[ResponseEvents] duplicate event ignored: task={}, id={}, type={}",
                    state.getTaskId(), eventId, event.getType());
            return EventTransition.duplicate(state);
        }

        long sequence = event.getSequenceNumber() != null
                ? base + event.getSequenceNumber()
                : state.nextLocalSequence();
        ResponseEvent persisted = event.toBuilder()
                .id(eventId)
                .sequenceNumber(sequence)
                .build();

        ConversationState next = state;
        Map<String, Object> item = itemOf(persisted);
        if (isApprovalRequest(persisted, item) && !isApprovalKnown(state, persisted.getItemId())) {
            persisted = persisted.withStatus(ResponseEvent.STATUS_WAITING_APPROVAL);
            next = ConversationTransitions.registerApproval(next, toApprovalRequest(state, persisted, item));
            log.info("[ResponseEvents] approval requested: task={}, approval={}, tool={}",
                    state.getTaskId(), persisted.getItemId(), item.get("name"));
        }

        next = ConversationTransitions.appendEvent(next, persisted);

        switch (persisted.getKind()) {
        case RESPONSE_CREATED -> {
            String responseId = responseIdOf(persisted);
            next = ConversationTransitions.updateLastResponseId(next, responseId);
            next = ConversationTransitions.enterResponseScope(next, responseId);
        }
        case OUTPUT_ITEM_DONE -> next = appendAssistantMessage(next, item);
        case RESPONSE_COMPLETED -> next = applyCompletedOutput(next, persisted);
        default -> {
            // persisted only
        }
        }

        log.debug("[ResponseEvents] persisted: task={}, id={}, type={}, seq={}",
                state.getTaskId(), eventId, persisted.getType(), sequence);
        return EventTransition.persisted(next);
    }

    private String resolveEventId(ResponseEvent event, String fallbackScope) {
        if (event.getId() != null) {
            return event.getId();
        }
        String scope = responseIdOf(event);
        if (scope == null) {
            scope = fallbackScope;
        }
        if (event.getSequenceNumber() != null) {
            return scope + ":" + event.getSequenceNumber();
        }
        if (event.getItemId() != null) {
            return scope + ":" + event.getType() + ":" + event.getItemId();
        }
        return "evt_" + UUID.randomUUID();
    }

    private boolean isApprovalRequest(ResponseEvent event, Map<String, Object> item) {
        ResponseEventKind kind = event.getKind();
        return (kind == ResponseEventKind.OUTPUT_ITEM_ADDED || kind == ResponseEventKind.OUTPUT_ITEM_DONE)
                && item != null
                && ITEM_TYPE_APPROVAL_REQUEST.equals(item.get("type"))
                && event.getItemId() != null;
    }

    /**
     * An approval is known once any event for its item carries a status, which
     * covers both a pending request and one already resolved.
     */
    private boolean isApprovalKnown(ConversationState state, String approvalId) {
        if (state.getPendingApprovals().containsKey(approvalId)) {
            return true;
        }
        for (ResponseEvent existing : state.getEvents()) {
            if (approvalId.equals(existing.getItemId()) && existing.getStatus() != null) {
                return true;
            }
        }
        return false;
    }

    private ApprovalRequest toApprovalRequest(ConversationState state, ResponseEvent event,
            Map<String, Object> item) {
        return ApprovalRequest.builder()
                .id(event.getItemId())
                .toolName(stringOf(item.get("name")))
                .arguments(stringOf(item.get("arguments")))
                .serverLabel(stringOf(item.get("server_label")))
                .continuationToken(state.getLastResponseId())
                .requestPayload(item)
                .build();
    }

    private ConversationState applyCompletedOutput(ConversationState state, ResponseEvent event) {
        Map<String, Object> response = payloadField(event, "response");
        if (response == null) {
            return state;
        }
        logUsage(state, response);
        ConversationState next = ConversationTransitions.updateLastResponseId(state, stringOf(response.get("id")));
        if (response.get("output") instanceof List<?> output) {
            for (Object entry : output) {
                next = appendAssistantMessage(next, mapOf(entry));
            }
        }
        return next;
    }

    private ConversationState appendAssistantMessage(ConversationState state, Map<String, Object> item) {
        if (item == null || !ITEM_TYPE_MESSAGE.equals(item.get("type"))
                || !Message.ROLE_ASSISTANT.equals(item.get("role"))) {
            return state;
        }
        String itemId = stringOf(item.get("id"));
        if (itemId != null && state.getAssistantItemIds().contains(itemId)) {
            return state;
        }
        String text = concatOutputText(item.get("content"));
        if (text.isEmpty()) {
            return state;
        }
        ConversationState next = ConversationTransitions.appendMessages(state, List.of(Message.assistant(text)));
        return ConversationTransitions.rememberAssistantItem(next, itemId);
    }

    private String concatOutputText(Object content) {
        if (!(content instanceof List<?> parts)) {
            return "";
        }
        StringBuilder text = new StringBuilder();
        for (Object part : parts) {
            Map<String, Object> partMap = mapOf(part);
            if (partMap != null && PART_TYPE_OUTPUT_TEXT.equals(partMap.get("type"))
                    && partMap.get("text") instanceof String chunk) {
                text.append(chunk);
            }
        }
        return text.toString();
    }

    private void logUsage(ConversationState state, Map<String, Object> response) {
        Map<String, Object> usage = mapOf(response.get("usage"));
        if (usage != null) {
            log.debug("[ResponseEvents] response completed: task={}, response={}, input_tokens={}, output_tokens={}",
                    state.getTaskId(), response.get("id"), usage.get("input_tokens"), usage.get("output_tokens"));
        }
    }

    private static String responseIdOf(ResponseEvent event) {
        if (event.getKind() != ResponseEventKind.RESPONSE_CREATED
                && event.getKind() != ResponseEventKind.RESPONSE_IN_PROGRESS
                && event.getKind() != ResponseEventKind.RESPONSE_COMPLETED) {
            return null;
        }
        Map<String, Object> response = payloadField(event, "response");
        return response != null ? stringOf(response.get("id")) : null;
    }

    private static Map<String, Object> itemOf(ResponseEvent event) {
        return payloadField(event, "item");
    }

    private static Map<String, Object> payloadField(ResponseEvent event, String field) {
        return event.getPayload() != null ? mapOf(event.getPayload().get(field)) : null;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> mapOf(Object value) {
        return value instanceof Map<?, ?> ? (Map<String, Object>) value : null;
    }

    private static String stringOf(Object value) {
        return value instanceof String text ? text : null;
    }
}
