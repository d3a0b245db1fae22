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
import me.golemcore.orchestrator.domain.model.ErrorSource;
import me.golemcore.orchestrator.domain.model.ResponseEvent;
import me.golemcore.orchestrator.domain.model.ResponseEventKind;
import me.golemcore.orchestrator.domain.model.ResponsesRequest;
import me.golemcore.orchestrator.domain.model.TraceSpan;
import me.golemcore.orchestrator.domain.model.TurnContext;
import me.golemcore.orchestrator.port.outbound.ResponsesApiPort;
import me.golemcore.orchestrator.port.outbound.TraceSpanPort;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Default {@link LlmCallOrchestrator} backed by the responses API port.
 *
 * <p>
 * Each call builds one request, classifies the raw stream and records a trace
 * span when the stream terminates. A second call for a task whose previous
 * call has not terminated is rejected.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DefaultLlmCallOrchestrator implements LlmCallOrchestrator {

    static final String SPAN_NAME = "llm.call";
    static final String ERROR_CODE = "llm_call_failed";

    private final ResponsesApiPort responsesApiPort;
    private final ResponsesRequestBuilder requestBuilder;
    private final ResponseEventClassifier classifier;
    private final TraceSpanPort traceSpanPort;
    private final Clock clock;

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    @Override
    public Flux<ResponseEvent> call(TurnContext context) {
        return Flux.defer(() -> {
            String taskId = context.taskId();
            if (!inFlight.add(taskId)) {
                return Flux.error(new IllegalStateException("LLM call already in flight for task " + taskId));
            }

            ResponsesRequest request = requestBuilder.build(context);
            CallRecorder recorder = new CallRecorder(context, request.getModel(), clock.instant());
            log.info("[LlmCall] start: task={}, model={}, continuation={}, approval={}",
                    taskId, request.getModel(), request.getPreviousResponseId(), context.isApprovalContinuation());

            return responsesApiPort.stream(request)
                    .map(classifier::classify)
                    .doOnNext(recorder::observe)
                    .onErrorResume(error -> {
                        LlmCallFailedException failure = toFailure(error);
                        recorder.fail(failure.getSource());
                        log.warn("[LlmCall] failed: task={}, source={}: {}",
                                taskId, failure.getSource().getValue(), failure.getMessage());
                        ResponseEvent errorEvent = classifier.error(failure.getSource(), ERROR_CODE,
                                failure.getMessage());
                        return Flux.concat(Flux.just(errorEvent), Flux.error(failure));
                    })
                    .doOnTerminate(recorder::finish)
                    .doOnCancel(recorder::finish);
        });
    }

    private LlmCallFailedException toFailure(Throwable error) {
        if (error instanceof LlmCallFailedException failure) {
            return failure;
        }
        if (error instanceof IOException || error.getCause() instanceof IOException) {
            return new LlmCallFailedException(ErrorSource.NETWORK, error.getMessage(), error);
        }
        return new LlmCallFailedException(ErrorSource.BACKEND, error.getMessage(), error);
    }

    private void emitSpan(TraceSpan span) {
        try {
            traceSpanPort.emit(span);
        } catch (RuntimeException e) { // NOSONAR - telemetry must never fail a call
            log.warn("[LlmCall] trace span emission failed: {}", e.getMessage());
        }
    }

    private final class CallRecorder {

        private final TurnContext context;
        private final String model;
        private final Instant startedAt;
        private final AtomicBoolean finished = new AtomicBoolean(false);

        private volatile String responseId;
        private volatile Long inputTokens;
        private volatile Long outputTokens;
        private volatile ErrorSource errorSource;

        private CallRecorder(TurnContext context, String model, Instant startedAt) {
            this.context = context;
            this.model = model;
            this.startedAt = startedAt;
        }

        void observe(ResponseEvent event) {
            if (event.getKind() != ResponseEventKind.RESPONSE_CREATED
                    && event.getKind() != ResponseEventKind.RESPONSE_COMPLETED) {
                return;
            }
            Object response = event.getPayload().get("response");
            if (!(response instanceof Map<?, ?> responseMap)) {
                return;
            }
            if (responseMap.get("id") instanceof String id) {
                responseId = id;
            }
            if (responseMap.get("usage") instanceof Map<?, ?> usage) {
                inputTokens = toLong(usage.get("input_tokens"));
                outputTokens = toLong(usage.get("output_tokens"));
            }
        }

        void fail(ErrorSource source) {
            errorSource = source;
        }

        void finish() {
            if (!finished.compareAndSet(false, true)) {
                return;
            }
            inFlight.remove(context.taskId());
            long durationMs = Duration.between(startedAt, clock.instant()).toMillis();
            log.info("[LlmCall] finished: task={}, response={}, duration={}ms, status={}",
                    context.taskId(), responseId, durationMs,
                    errorSource == null ? TraceSpan.STATUS_OK : TraceSpan.STATUS_ERROR);
            emitSpan(TraceSpan.builder()
                    .name(SPAN_NAME)
                    .taskId(context.taskId())
                    .agentId(context.agentId())
                    .model(model)
                    .responseId(responseId)
                    .startedAt(startedAt)
                    .durationMs(durationMs)
                    .status(errorSource == null ? TraceSpan.STATUS_OK : TraceSpan.STATUS_ERROR)
                    .errorSource(errorSource)
                    .inputTokens(inputTokens)
                    .outputTokens(outputTokens)
                    .build());
        }

        private Long toLong(Object value) {
            return value instanceof Number number ? number.longValue() : null;
        }
    }
}
