package me.golemcore.orchestrator.domain.model;

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

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable state of one conversation.
 *
 * <p>
 * Every mutation produces a new instance through the transition functions in
 * {@code ConversationTransitions} and {@code ResponseEventProcessor}, so a
 * reference read at any time is a consistent view. Collections held here are
 * unmodifiable.
 *
 * <p>
 * Events are kept in arrival order; {@code eventIds} mirrors their ids for
 * deduplication. {@code sequenceBase} is the offset applied to upstream
 * sequence numbers of the call in progress, so numbers restarting at zero for
 * every response still sort after earlier turns. {@code callScope} prefixes
 * fallback ids of events without an upstream id: a per-call token until the
 * call's {@code response.created} arrives, the response id afterwards.
 *
 * @since 1.0
 */
@Value
@Builder(toBuilder = true)
public class ConversationState {

    String agentId;
    String taskId;
    @Builder.Default
    ConversationPhase phase = ConversationPhase.UNINITIALIZED;
    boolean initialized;
    boolean ended;

    @Builder.Default
    List<Message> messages = List.of();
    @Builder.Default
    List<ResponseEvent> events = List.of();
    @Builder.Default
    Set<String> eventIds = Set.of();

    String lastResponseId;
    int responseIndex;
    @Builder.Default
    Map<String, ApprovalRequest> pendingApprovals = Map.of();

    @Builder.Default
    List<ToolDescriptor> toolConfig = List.of();
    ModelConfig modelConfig;

    long sequenceBase;
    int callCount;
    String callScope;
    @Builder.Default
    long maxSequenceNumber = -1L;
    @Builder.Default
    Set<String> assistantItemIds = Set.of();

    @Builder.Default
    List<Todo> todos = List.of();
    @Builder.Default
    Map<String, Subtask> subtasks = Map.of();

    public static ConversationState create(String agentId, String taskId) {
        return ConversationState.builder()
                .agentId(agentId)
                .taskId(taskId)
                .build();
    }

    public boolean hasEvent(String eventId) {
        return eventId != null && eventIds.contains(eventId);
    }

    public long nextLocalSequence() {
        return maxSequenceNumber + 1;
    }
}
