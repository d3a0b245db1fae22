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
import me.golemcore.orchestrator.domain.exception.ConversationEndedException;
import me.golemcore.orchestrator.domain.exception.ConversationNotFoundException;
import me.golemcore.orchestrator.domain.exception.TaskOwnershipConflictException;
import me.golemcore.orchestrator.domain.model.ApprovalResult;
import me.golemcore.orchestrator.domain.model.ConversationSnapshot;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.domain.model.Subtask;
import me.golemcore.orchestrator.domain.model.SubtaskNotification;
import me.golemcore.orchestrator.domain.model.Todo;
import me.golemcore.orchestrator.domain.model.TodoUpdateResult;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.inbound.ConversationPort;
import me.golemcore.orchestrator.port.outbound.LiveTransportPort;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;

/**
 * Registry of conversation actors keyed by task id.
 *
 * <p>
 * Each task gets exactly one {@link ConversationActor}, created on first use
 * and initialized immediately. Calls for one task are funneled into that
 * actor's mailbox; the blocking methods here wait for the actor's result on
 * the caller thread.
 */
@Service
@Slf4j
public class ConversationService implements ConversationPort {

    private final ExecutorService conversationExecutor;
    private final ConversationInitializer initializer;
    private final MessageTurnHandler messageTurnHandler;
    private final ApprovalHandler approvalHandler;
    private final TaskProgressHandler taskProgressHandler;
    private final ResponseEventProcessor processor;
    private final ResponseEventClassifier classifier;
    private final LiveTransportPort liveTransport;
    private final OrchestratorProperties properties;

    private final Map<String, ConversationActor> conversations = new ConcurrentHashMap<>();

    @SuppressWarnings("java:S107")
    public ConversationService(@Qualifier("conversationExecutor") ExecutorService conversationExecutor,
            ConversationInitializer initializer, MessageTurnHandler messageTurnHandler,
            ApprovalHandler approvalHandler, TaskProgressHandler taskProgressHandler,
            ResponseEventProcessor processor, ResponseEventClassifier classifier,
            LiveTransportPort liveTransport, OrchestratorProperties properties) {
        this.conversationExecutor = conversationExecutor;
        this.initializer = initializer;
        this.messageTurnHandler = messageTurnHandler;
        this.approvalHandler = approvalHandler;
        this.taskProgressHandler = taskProgressHandler;
        this.processor = processor;
        this.classifier = classifier;
        this.liveTransport = liveTransport;
        this.properties = properties;
    }

    @Override
    public ConversationSnapshot create(String agentId, String taskId) {
        requireText(agentId, "agentId");
        requireText(taskId, "taskId");

        ConversationActor candidate = newActor(agentId, taskId);
        ConversationActor existing = conversations.putIfAbsent(taskId, candidate);
        if (existing == null) {
            log.info("[Conversation] created: task={}, agent={}", taskId, agentId);
            candidate.start();
            return candidate.snapshot();
        }
        if (!Objects.equals(existing.getAgentId(), agentId)) {
            throw new TaskOwnershipConflictException(taskId, existing.getAgentId());
        }
        return existing.snapshot();
    }

    @Override
    public List<Message> handleMessages(String taskId, List<Message> batch) {
        ConversationActor actor = require(taskId);
        if (actor.isEndRequested()) {
            throw new ConversationEndedException(taskId);
        }
        actor.awaitInitialized(properties.getConversation().getInitTimeout());
        return await(actor.submitMessages(batch != null ? List.copyOf(batch) : List.of()));
    }

    @Override
    public ApprovalResult resolveApproval(String taskId, String approvalId, boolean approved) {
        return await(require(taskId).submitApproval(approvalId, approved));
    }

    @Override
    public void ingestResponseEvent(String taskId, Map<String, Object> rawEvent) {
        await(require(taskId).submitResponseEvent(rawEvent));
    }

    @Override
    public TodoUpdateResult updateTodos(String taskId, List<Todo> todos) {
        ConversationActor actor = require(taskId);
        if (actor.isEndRequested()) {
            throw new ConversationEndedException(taskId);
        }
        actor.awaitInitialized(properties.getConversation().getInitTimeout());
        return await(actor.submitTodoUpdate(List.copyOf(todos)));
    }

    @Override
    public Subtask registerSubtask(String taskId, Subtask subtask) {
        return await(require(taskId).submitSubtaskRegistration(subtask));
    }

    @Override
    public Optional<Subtask> notifySubtask(String taskId, SubtaskNotification notification) {
        return await(require(taskId).submitSubtaskNotification(notification));
    }

    @Override
    public void end(String taskId) {
        require(taskId).end();
    }

    @Override
    public ConversationSnapshot snapshot(String taskId) {
        return require(taskId).snapshot();
    }

    private ConversationActor newActor(String agentId, String taskId) {
        return new ConversationActor(agentId, taskId, conversationExecutor, initializer, messageTurnHandler,
                approvalHandler, taskProgressHandler, processor, classifier, liveTransport);
    }

    private ConversationActor require(String taskId) {
        ConversationActor actor = taskId != null ? conversations.get(taskId) : null;
        if (actor == null) {
            throw new ConversationNotFoundException(taskId);
        }
        return actor;
    }

    private <T> T await(CompletableFuture<T> future) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException(cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for conversation", e);
        }
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
    }
}
