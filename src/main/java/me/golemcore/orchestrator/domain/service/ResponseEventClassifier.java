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

import me.golemcore.orchestrator.domain.model.ErrorSource;
import me.golemcore.orchestrator.domain.model.ResponseEvent;
import me.golemcore.orchestrator.domain.model.ResponseEventKind;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Turns raw backend stream events into typed {@link ResponseEvent}s and builds
 * the events the orchestrator emits on its own (user echoes, errors).
 *
 * <p>
 * Classification only reads the event; ids and sequence numbers that need
 * conversation state are resolved later by {@link ResponseEventProcessor}.
 */
@Component
public class ResponseEventClassifier {

    private static final String FIELD_TYPE = "type";
    private static final String FIELD_ITEM = "item";

    private final Clock clock;

    public ResponseEventClassifier(Clock clock) {
        this.clock = clock;
    }

    public ResponseEvent classify(Map<String, Object> raw) {
        Map<String, Object> payload = raw != null ? raw : Map.of();
        String type = stringValue(payload.get(FIELD_TYPE));
        return ResponseEvent.builder()
                .id(resolveUpstreamId(payload))
                .type(type)
                .kind(ResponseEventKind.fromType(type))
                .sequenceNumber(longValue(payload.get("sequence_number")))
                .itemId(extractItemId(payload))
                .payload(Collections.unmodifiableMap(new LinkedHashMap<>(payload)))
                .timestamp(Instant.now(clock))
                .build();
    }

    /**
     * Builds the finalized user message item emitted before each user turn so
     * observers see the input in the event log.
     */
    public ResponseEvent userEcho(String text) {
        String itemId = "msg_user_" + UUID.randomUUID();

        Map<String, Object> part = new LinkedHashMap<>();
        part.put(FIELD_TYPE, "input_text");
        part.put("text", text != null ? text : "");

        Map<String, Object> item = new LinkedHashMap<>();
        item.put("id", itemId);
        item.put(FIELD_TYPE, "message");
        item.put("role", "user");
        item.put("status", "completed");
        item.put("content", List.of(part));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(FIELD_TYPE, ResponseEventKind.OUTPUT_ITEM_DONE.getType());
        payload.put(FIELD_ITEM, item);

        return ResponseEvent.builder()
                .id(itemId)
                .type(ResponseEventKind.OUTPUT_ITEM_DONE.getType())
                .kind(ResponseEventKind.OUTPUT_ITEM_DONE)
                .itemId(itemId)
                .payload(Collections.unmodifiableMap(payload))
                .timestamp(Instant.now(clock))
                .build();
    }

    public ResponseEvent error(ErrorSource source, String code, String message) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(FIELD_TYPE, ResponseEventKind.ERROR.getType());
        payload.put("code", code);
        payload.put("message", message != null ? message : "");
        payload.put("source", source.getValue());

        return ResponseEvent.builder()
                .id("err_" + UUID.randomUUID())
                .type(ResponseEventKind.ERROR.getType())
                .kind(ResponseEventKind.ERROR)
                .payload(Collections.unmodifiableMap(payload))
                .timestamp(Instant.now(clock))
                .build();
    }

    /**
     * Item id lookup order: {@code item_id}, then {@code item.id}.
     */
    static String extractItemId(Map<String, Object> payload) {
        String itemId = stringValue(payload.get("item_id"));
        if (itemId != null) {
            return itemId;
        }
        if (payload.get(FIELD_ITEM) instanceof Map<?, ?> item) {
            return stringValue(item.get("id"));
        }
        return null;
    }

    private static String resolveUpstreamId(Map<String, Object> payload) {
        String eventId = stringValue(payload.get("event_id"));
        return eventId != null ? eventId : stringValue(payload.get("id"));
    }

    private static String stringValue(Object value) {
        if (value instanceof String text && !text.isBlank()) {
            return text;
        }
        return null;
    }

    private static Long longValue(Object value) {
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof String text) {
            try {
                return Long.parseLong(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
