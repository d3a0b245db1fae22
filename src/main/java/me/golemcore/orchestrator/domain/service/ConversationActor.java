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
import me.golemcore.orchestrator.domain.exception.InitializationFailedException;
import me.golemcore.orchestrator.domain.exception.InitializationInterruptedException;
import me.golemcore.orchestrator.domain.exception.InitializationTimeoutException;
import me.golemcore.orchestrator.domain.model.ApprovalResult;
import me.golemcore.orchestrator.domain.model.ConversationSnapshot;
import me.golemcore.orchestrator.domain.model.ConversationState;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.domain.model.ResponseEvent;
import me.golemcore.orchestrator.domain.model.Subtask;
import me.golemcore.orchestrator.domain.model.SubtaskNotification;
import me.golemcore.orchestrator.domain.model.Todo;
import me.golemcore.orchestrator.domain.model.TodoUpdateResult;
import me.golemcore.orchestrator.port.outbound.LiveTransportPort;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Single-writer actor owning the state of one conversation.
 *
 * <p>
 * Work submitted from any thread is queued in a mailbox and run one task at a
 * time on a shared executor, so all mutations of a conversation are
 * serialized while different conversations proceed in parallel. The state is
 * an immutable value swapped atomically after every transition; snapshots
 * read it without locking and always see a complete pre- or post-transition
 * view.
 *
 * <p>
 * Initialization is the first task of the mailbox and completes a future that
 * message submitters wait on with a timeout. The end signal is recorded
 * immediately, so queued work and future turns are rejected, while the
 * terminal transition itself is queued behind a call in flight.
 */
@Slf4j
public class ConversationActor implements ConversationStateHolder {

    private final String taskId;
    private final ExecutorService executor;
    private final ConversationInitializer initializer;
    private final MessageTurnHandler messageTurnHandler;
    private final ApprovalHandler approvalHandler;
    private final TaskProgressHandler taskProgressHandler;
    private final ResponseEventProcessor processor;
    private final ResponseEventClassifier classifier;
    private final LiveTransportPort liveTransport;

    private final AtomicReference<ConversationState> state;
    private final CompletableFuture<Void> initialized = new CompletableFuture<>();
    private final Object lock = new Object();
    private final Deque<Envelope<?>> mailbox = new ArrayDeque<>();

    private boolean running = false;
    private volatile boolean endRequested = false;

    @SuppressWarnings("java:S107")
    public ConversationActor(String agentId, String taskId, ExecutorService executor,
            ConversationInitializer initializer, MessageTurnHandler messageTurnHandler,
            ApprovalHandler approvalHandler, TaskProgressHandler taskProgressHandler,
            ResponseEventProcessor processor, ResponseEventClassifier classifier,
            LiveTransportPort liveTransport) {
        this.taskId = taskId;
        this.executor = executor;
        this.initializer = initializer;
        this.messageTurnHandler = messageTurnHandler;
        this.approvalHandler = approvalHandler;
        this.taskProgressHandler = taskProgressHandler;
        this.processor = processor;
        this.classifier = classifier;
        this.liveTransport = liveTransport;
        this.state = new AtomicReference<>(ConversationState.create(agentId, taskId));
    }

    public String getAgentId() {
        return state.get().getAgentId();
    }

    /**
     * Queues initialization. Called once, right after construction.
     */
    public void start() {
        submit(() -> {
            runInitialization();
            return null;
        });
    }

    /**
     * Waits on the calling thread until initialization finished.
     *
     * @throws InitializationTimeoutException
     *             if the wait exceeds {@code timeout}; the conversation is not
     *             touched
     * @throws InitializationFailedException
     *             if configuration could not be loaded
     * @throws InitializationInterruptedException
     *             if the calling thread is interrupted while waiting
     */
    public void awaitInitialized(Duration timeout) {
        try {
            initialized.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new InitializationTimeoutException(taskId, timeout);
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InitializationInterruptedException(taskId, e);
        }
    }

    public CompletableFuture<List<Message>> submitMessages(List<Message> batch) {
        return submitMutation(() -> messageTurnHandler.handle(this, batch));
    }

    public CompletableFuture<ApprovalResult> submitApproval(String approvalId, boolean approved) {
        if (endRequested) {
            return CompletableFuture.completedFuture(ApprovalResult.ended(approvalId, approved));
        }
        return submit(() -> {
            if (endRequested) {
                return ApprovalResult.ended(approvalId, approved);
            }
            return approvalHandler.resolve(this, approvalId, approved);
        });
    }

    public CompletableFuture<Void> submitResponseEvent(Map<String, Object> rawEvent) {
        return submitMutation(() -> {
            process(classifier.classify(rawEvent));
            return null;
        });
    }

    public CompletableFuture<TodoUpdateResult> submitTodoUpdate(List<Todo> todos) {
        return submitMutation(() -> taskProgressHandler.updateTodos(this, todos));
    }

    public CompletableFuture<Subtask> submitSubtaskRegistration(Subtask subtask) {
        return submitMutation(() -> taskProgressHandler.registerSubtask(this, subtask));
    }

    public CompletableFuture<Optional<Subtask>> submitSubtaskNotification(SubtaskNotification notification) {
        return submitMutation(() -> taskProgressHandler.notifySubtask(this, notification));
    }

    /**
     * Ends the conversation. Idempotent.
     */
    public CompletableFuture<Void> end() {
        endRequested = true;
        return submit(() -> {
            if (!current().isEnded()) {
                update(ConversationTransitions::end);
                log.info("[Conversation] ended: task={}", taskId);
            }
            return null;
        });
    }

    public ConversationSnapshot snapshot() {
        return ConversationSnapshot.of(state.get());
    }

    @Override
    public ConversationState current() {
        return state.get();
    }

    @Override
    public ConversationState update(UnaryOperator<ConversationState> transition) {
        return state.updateAndGet(transition);
    }

    @Override
    public void process(ResponseEvent event) {
        EventTransition transition = processor.process(state.get(), event);
        state.set(transition.state());
        for (ResponseEvent liveEvent : transition.liveEvents()) {
            publishLive(liveEvent);
        }
    }

    @Override
    public boolean isEndRequested() {
        return endRequested;
    }

    private void runInitialization() {
        update(ConversationTransitions::beginInitialization);
        try {
            update(initializer::initialize);
            initialized.complete(null);
        } catch (RuntimeException e) { // NOSONAR - failure is handed to every waiter
            log.error("[Conversation] initialization failed: task={}: {}", taskId, e.getMessage());
            endRequested = true;
            update(ConversationTransitions::end);
            initialized.completeExceptionally(e instanceof InitializationFailedException
                    ? e
                    : new InitializationFailedException(e.getMessage(), e));
        }
    }

    private <T> CompletableFuture<T> submitMutation(Callable<T> mutation) {
        if (endRequested) {
            return CompletableFuture.failedFuture(new ConversationEndedException(taskId));
        }
        return submit(() -> {
            requireNotEnded();
            return mutation.call();
        });
    }

    private void requireNotEnded() {
        if (endRequested || current().isEnded()) {
            throw new ConversationEndedException(taskId);
        }
    }

    private void publishLive(ResponseEvent event) {
        try {
            liveTransport.publish(taskId, event);
        } catch (RuntimeException e) { // NOSONAR - live streaming is best effort
            log.debug("[Conversation] live transport rejected event {}: {}", event.getType(), e.getMessage());
        }
    }

    private <T> CompletableFuture<T> submit(Callable<T> task) {
        Envelope<T> envelope = new Envelope<>(task);
        boolean dispatch;
        synchronized (lock) {
            mailbox.addLast(envelope);
            dispatch = !running;
            running = true;
        }
        if (dispatch) {
            dispatchNext();
        }
        return envelope.result;
    }

    private void dispatchNext() {
        Envelope<?> next;
        synchronized (lock) {
            next = mailbox.pollFirst();
            if (next == null) {
                running = false;
                return;
            }
        }
        try {
            executor.execute(() -> {
                try {
                    next.run();
                } finally {
                    dispatchNext();
                }
            });
        } catch (RejectedExecutionException e) {
            log.error("[Conversation] executor rejected work: task={}", taskId);
            rejectAll(next, e);
        }
    }

    private void rejectAll(Envelope<?> first, RejectedExecutionException cause) {
        first.reject(cause);
        synchronized (lock) {
            Envelope<?> queued;
            while ((queued = mailbox.pollFirst()) != null) {
                queued.reject(cause);
            }
            running = false;
        }
    }

    private static RuntimeException unwrap(Throwable cause) {
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        return new IllegalStateException(cause);
    }

    private static final class Envelope<T> {

        private final Callable<T> task;
        private final CompletableFuture<T> result = new CompletableFuture<>();

        private Envelope(Callable<T> task) {
            this.task = task;
        }

        void run() {
            try {
                result.complete(task.call());
            } catch (Exception e) { // NOSONAR - must not kill executor thread
                result.completeExceptionally(e);
            }
        }

        void reject(Throwable cause) {
            result.completeExceptionally(cause);
        }
    }
}
