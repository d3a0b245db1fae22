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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.exception.LlmCallFailedException;
import me.golemcore.orchestrator.domain.exception.TurnFailedException;
import me.golemcore.orchestrator.domain.model.ErrorSource;
import me.golemcore.orchestrator.domain.model.Message;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Entry point for new user turns.
 *
 * <p>
 * The whole batch is appended to the message log first. Then, for each user
 * message in order, an echo event is persisted and exactly one LLM call runs
 * to completion before the next message is looked at. A failed turn is
 * recorded as an error event and aborts the rest of the batch with a
 * non-retryable {@link TurnFailedException}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MessageTurnHandler {

    static final String INTERNAL_ERROR_CODE = "agent_error";

    private final TurnExecutor turnExecutor;
    private final ResponseEventClassifier classifier;

    public List<Message> handle(ConversationStateHolder holder, List<Message> batch) {
        String taskId = holder.current().getTaskId();
        holder.update(state -> ConversationTransitions.appendMessages(state, batch));

        int turn = 0;
        for (Message message : batch) {
            if (!message.isUserMessage()) {
                continue;
            }
            if (holder.isEndRequested()) {
                log.info("[Conversation] end requested, skipping remaining turns: task={}", taskId);
                break;
            }
            turn++;
            holder.process(classifier.userEcho(message.getContent()));
            try {
                turnExecutor.execute(holder, null);
            } catch (RuntimeException e) { // NOSONAR - every turn failure is recorded before rethrow
                throw recordFailure(holder, taskId, turn, e);
            }
        }
        return holder.current().getMessages();
    }

    private TurnFailedException recordFailure(ConversationStateHolder holder, String taskId, int turn,
            RuntimeException failure) {
        ErrorSource source;
        if (failure instanceof LlmCallFailedException llmFailure) {
            // the orchestrator has already emitted the error event for this call
            source = llmFailure.getSource();
        } else {
            source = ErrorSource.INTERNAL;
            holder.process(classifier.error(source, INTERNAL_ERROR_CODE, failure.getMessage()));
        }
        log.error("[Conversation] turn {} failed: task={}, source={}: {}",
                turn, taskId, source.getValue(), failure.getMessage(), failure);
        return new TurnFailedException(source, "Turn " + turn + " failed: " + failure.getMessage(), failure);
    }
}
