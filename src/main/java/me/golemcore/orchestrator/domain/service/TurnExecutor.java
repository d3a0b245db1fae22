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

import lombok.RequiredArgsConstructor;
import me.golemcore.orchestrator.domain.model.ApprovalDecision;
import me.golemcore.orchestrator.domain.model.ConversationState;
import me.golemcore.orchestrator.domain.model.ResponseEvent;
import me.golemcore.orchestrator.domain.model.TurnContext;
import org.springframework.stereotype.Component;

/**
 * Runs one LLM call for a conversation and feeds its stream, event by event,
 * through the response event processor.
 *
 * <p>
 * The caller's thread is the conversation actor, so the stream is consumed
 * blocking and the next turn cannot start before this one terminates.
 */
@Component
@RequiredArgsConstructor
public class TurnExecutor {

    private final LlmCallOrchestrator orchestrator;

    /**
     * Executes a message turn, or an approval continuation when
     * {@code decision} is not {@code null}. Stream failures are rethrown after
     * the events received so far have been processed.
     */
    public void execute(ConversationStateHolder holder, ApprovalDecision decision) {
        ConversationState started = holder.update(ConversationTransitions::beginCall);
        TurnContext context = decision == null
                ? TurnContext.forMessages(started)
                : TurnContext.forApproval(started, decision);
        try {
            for (ResponseEvent event : orchestrator.call(context).toIterable()) {
                holder.process(event);
            }
        } finally {
            holder.update(ConversationTransitions::finishCall);
        }
    }
}
