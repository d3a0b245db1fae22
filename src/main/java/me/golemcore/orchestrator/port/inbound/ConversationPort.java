package me.golemcore.orchestrator.port.inbound;

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

import me.golemcore.orchestrator.domain.model.ApprovalResult;
import me.golemcore.orchestrator.domain.model.ConversationSnapshot;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.domain.model.Subtask;
import me.golemcore.orchestrator.domain.model.SubtaskNotification;
import me.golemcore.orchestrator.domain.model.Todo;
import me.golemcore.orchestrator.domain.model.TodoUpdateResult;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Inbound port used by the host to drive conversations. Each conversation is
 * identified by its task id; all mutating calls for one task are serialized.
 */
public interface ConversationPort {

    /**
     * Creates the conversation for a task and starts its initialization.
     * Creating an existing task returns the existing conversation unchanged.
     */
    ConversationSnapshot create(String agentId, String taskId);

    /**
     * Appends a batch of messages and runs one LLM call per user message.
     * Blocks until the batch is processed.
     *
     * @return the message log after the batch
     */
    List<Message> handleMessages(String taskId, List<Message> batch);

    /**
     * Resumes a paused tool call with the human decision. Never throws for
     * unknown approvals or failed continuation calls.
     */
    ApprovalResult resolveApproval(String taskId, String approvalId, boolean approved);

    /**
     * Feeds a raw backend stream event delivered by the host through the
     * response event processor.
     */
    void ingestResponseEvent(String taskId, Map<String, Object> rawEvent);

    /**
     * Replaces the agent's todo list and, when the list is not empty, appends a
     * developer progress message for the next call.
     */
    TodoUpdateResult updateTodos(String taskId, List<Todo> todos);

    /**
     * Starts tracking a child task delegated to another agent.
     */
    Subtask registerSubtask(String taskId, Subtask subtask);

    /**
     * Applies a child task's status change.
     *
     * @return the updated child task, empty when it is not tracked here
     */
    Optional<Subtask> notifySubtask(String taskId, SubtaskNotification notification);

    /**
     * Ends the conversation. Calls already queued are rejected; a call in
     * flight finishes.
     */
    void end(String taskId);

    ConversationSnapshot snapshot(String taskId);
}
