package me.golemcore.orchestrator.adapter.inbound.event;

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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.exception.MalformedInboundEventException;
import me.golemcore.orchestrator.domain.model.ApprovalResult;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.domain.model.Subtask;
import me.golemcore.orchestrator.domain.model.SubtaskNotification;
import me.golemcore.orchestrator.domain.model.Todo;
import me.golemcore.orchestrator.port.inbound.ConversationPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Funnels raw inbound events from the host into the conversation port.
 *
 * <p>
 * Supported events:
 * <ul>
 * <li>{@code messages} - {@code {messages: [{role, content}]}}</li>
 * <li>{@code approval_decision} (alias {@code mcp_approval}) -
 * {@code {approval_id, approved}}</li>
 * <li>{@code end} - {@code {}}</li>
 * <li>{@code response_item} - a raw backend stream event
 * {@code {type, ...}}</li>
 * <li>{@code todo_update} - {@code {todos: [{id, content, status}]}}, the
 * full list</li>
 * <li>{@code subtask_register} - {@code {task_id, title, agent_name}}</li>
 * <li>{@code subtask_notify} - {@code {task_id, title, status, message}}</li>
 * </ul>
 *
 * Unknown event names and payloads that do not match these shapes are logged
 * and dropped; they never reach the conversation. Failures raised by the
 * conversation itself propagate to the caller.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InboundEventRouter {

    public static final String EVENT_MESSAGES = "messages";
    public static final String EVENT_APPROVAL_DECISION = "approval_decision";
    public static final String EVENT_MCP_APPROVAL = "mcp_approval";
    public static final String EVENT_END = "end";
    public static final String EVENT_RESPONSE_ITEM = "response_item";
    public static final String EVENT_TODO_UPDATE = "todo_update";
    public static final String EVENT_SUBTASK_REGISTER = "subtask_register";
    public static final String EVENT_SUBTASK_NOTIFY = "subtask_notify";

    private static final String DEFAULT_SUBTASK_TITLE = "Subtask";

    private static final TypeReference<Map<String, Object>> RAW_EVENT_TYPE = new TypeReference<>() {
    };

    private final ConversationPort conversationPort;
    private final ObjectMapper objectMapper;

    public InboundEventResult route(String taskId, String eventName, JsonNode payload) {
        try {
            return switch (eventName != null ? eventName : "") {
            case EVENT_MESSAGES -> {
                List<Message> batch = parseMessages(payload);
                yield InboundEventResult.accepted(eventName, conversationPort.handleMessages(taskId, batch));
            }
            case EVENT_APPROVAL_DECISION, EVENT_MCP_APPROVAL -> {
                ApprovalResult result = routeApproval(taskId, payload);
                yield InboundEventResult.accepted(eventName, result);
            }
            case EVENT_END -> {
                conversationPort.end(taskId);
                yield InboundEventResult.accepted(eventName, null);
            }
            case EVENT_RESPONSE_ITEM -> {
                conversationPort.ingestResponseEvent(taskId, parseRawEvent(payload));
                yield InboundEventResult.accepted(eventName, null);
            }
            case EVENT_TODO_UPDATE -> InboundEventResult.accepted(eventName,
                    conversationPort.updateTodos(taskId, parseTodos(payload)));
            case EVENT_SUBTASK_REGISTER -> InboundEventResult.accepted(eventName,
                    conversationPort.registerSubtask(taskId, parseSubtask(payload)));
            case EVENT_SUBTASK_NOTIFY -> InboundEventResult.accepted(eventName,
                    conversationPort.notifySubtask(taskId, parseSubtaskNotification(payload)).orElse(null));
            default -> throw new MalformedInboundEventException("Unknown inbound event: " + eventName);
            };
        } catch (MalformedInboundEventException e) {
            log.warn("[Inbound] dropping malformed event '{}' for task {}: {}", eventName, taskId, e.getMessage());
            return InboundEventResult.ignored(eventName, e.getMessage());
        }
    }

    private List<Message> parseMessages(JsonNode payload) {
        JsonNode messages = payload != null ? payload.get(EVENT_MESSAGES) : null;
        if (messages == null || !messages.isArray()) {
            throw new MalformedInboundEventException("'messages' must be an array");
        }
        List<Message> batch = new ArrayList<>();
        for (JsonNode node : messages) {
            JsonNode role = node.get("role");
            JsonNode content = node.get("content");
            if (role == null || !role.isTextual() || !Message.isKnownRole(role.asText())) {
                throw new MalformedInboundEventException("Unsupported message role: " + role);
            }
            if (content == null || !content.isTextual()) {
                throw new MalformedInboundEventException("Message content must be text");
            }
            batch.add(new Message(role.asText(), content.asText()));
        }
        return batch;
    }

    private ApprovalResult routeApproval(String taskId, JsonNode payload) {
        JsonNode approvalId = payload != null ? payload.get("approval_id") : null;
        JsonNode approved = payload != null ? payload.get("approved") : null;
        if (approvalId == null || !approvalId.isTextual() || approvalId.asText().isBlank()) {
            throw new MalformedInboundEventException("'approval_id' is required");
        }
        if (approved == null || !approved.isBoolean()) {
            throw new MalformedInboundEventException("'approved' must be a boolean");
        }
        return conversationPort.resolveApproval(taskId, approvalId.asText(), approved.asBoolean());
    }

    private List<Todo> parseTodos(JsonNode payload) {
        JsonNode todos = payload != null ? payload.get("todos") : null;
        if (todos == null || !todos.isArray()) {
            throw new MalformedInboundEventException("'todos' must be an array");
        }
        List<Todo> parsed = new ArrayList<>();
        for (JsonNode node : todos) {
            if (!node.isObject()) {
                throw new MalformedInboundEventException("Todo must be an object");
            }
            parsed.add(Todo.builder()
                    .id(requiredId(node, "id"))
                    .content(optionalText(node, "content", ""))
                    .status(optionalText(node, "status", Todo.STATUS_IN_PROGRESS))
                    .build());
        }
        return parsed;
    }

    private Subtask parseSubtask(JsonNode payload) {
        return Subtask.builder()
                .taskId(requiredId(payload, "task_id"))
                .title(optionalText(payload, "title", DEFAULT_SUBTASK_TITLE))
                .agentName(optionalText(payload, "agent_name", null))
                .status(Subtask.STATUS_IN_PROGRESS)
                .build();
    }

    private SubtaskNotification parseSubtaskNotification(JsonNode payload) {
        String status = optionalText(payload, "status", null);
        if (status == null || status.isBlank()) {
            throw new MalformedInboundEventException("'status' is required");
        }
        return SubtaskNotification.builder()
                .taskId(requiredId(payload, "task_id"))
                .title(optionalText(payload, "title", DEFAULT_SUBTASK_TITLE))
                .status(status)
                .message(optionalText(payload, "message", ""))
                .build();
    }

    /**
     * Ids may arrive as JSON strings or numbers.
     */
    private static String requiredId(JsonNode node, String field) {
        JsonNode value = node != null ? node.get(field) : null;
        if (value == null || !(value.isTextual() || value.isIntegralNumber()) || value.asText().isBlank()) {
            throw new MalformedInboundEventException("'" + field + "' is required");
        }
        return value.asText();
    }

    private static String optionalText(JsonNode node, String field, String defaultValue) {
        JsonNode value = node != null ? node.get(field) : null;
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        if (!value.isTextual()) {
            throw new MalformedInboundEventException("'" + field + "' must be text");
        }
        return value.asText();
    }

    private Map<String, Object> parseRawEvent(JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            throw new MalformedInboundEventException("Response event must be a JSON object");
        }
        try {
            return objectMapper.convertValue(payload, RAW_EVENT_TYPE);
        } catch (IllegalArgumentException e) {
            throw new MalformedInboundEventException("Response event could not be read", e);
        }
    }
}
