package me.golemcore.orchestrator.adapter.outbound.llm;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.exception.LlmCallFailedException;
import me.golemcore.orchestrator.domain.model.ErrorSource;
import me.golemcore.orchestrator.domain.model.ResponsesRequest;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.ResponsesApiPort;
import okhttp3.Call;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.BufferedSource;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.util.Map;

/**
 * Adapter for the OpenAI Responses API with server-sent event streaming.
 *
 * <p>
 * Sends one {@code POST /responses} per call and parses the SSE body frame by
 * frame: {@code data:} lines are joined until a blank line and decoded as a
 * JSON object. The {@code [DONE]} sentinel and other SSE fields are ignored;
 * frames that are not valid JSON are dropped with a warning.
 *
 * <p>
 * Failure mapping:
 * <ul>
 * <li>missing API key or non-2xx status - {@code LlmCallFailed{backend}}</li>
 * <li>I/O failure while connecting or reading - {@code LlmCallFailed{network}}</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OpenAiResponsesAdapter implements ResponsesApiPort {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final TypeReference<Map<String, Object>> EVENT_TYPE = new TypeReference<>() {
    };
    private static final String DATA_PREFIX = "data:";
    private static final String DONE_SENTINEL = "[DONE]";
    private static final int MAX_ERROR_BODY_LENGTH = 500;

    private final OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;
    private final OrchestratorProperties properties;

    @Override
    public Flux<Map<String, Object>> stream(ResponsesRequest request) {
        return Flux.<Map<String, Object>>create(sink -> execute(request, sink))
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public boolean isAvailable() {
        String apiKey = properties.getLlm().getApiKey();
        return apiKey != null && !apiKey.isBlank();
    }

    private void execute(ResponsesRequest request, FluxSink<Map<String, Object>> sink) {
        if (!isAvailable()) {
            sink.error(new LlmCallFailedException(ErrorSource.BACKEND, "Responses API key is not configured"));
            return;
        }

        String body;
        try {
            body = objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            sink.error(new LlmCallFailedException(ErrorSource.BACKEND, "Failed to serialize request", e));
            return;
        }

        Request httpRequest = new Request.Builder()
                .url(buildUrl())
                .header("Authorization", "Bearer " + properties.getLlm().getApiKey())
                .header("Accept", "text/event-stream")
                .post(RequestBody.create(body, JSON))
                .build();

        Call call = okHttpClient.newCall(httpRequest);
        sink.onCancel(call::cancel);

        try (Response response = call.execute()) {
            ResponseBody responseBody = response.body();
            if (!response.isSuccessful()) {
                String detail = responseBody != null ? truncate(responseBody.string()) : "";
                log.warn("[ResponsesApi] HTTP {}: {}", response.code(), detail);
                sink.error(new LlmCallFailedException(ErrorSource.BACKEND,
                        "Responses API returned HTTP " + response.code() + ": " + detail));
                return;
            }
            if (responseBody != null) {
                readEvents(responseBody.source(), sink);
            }
            sink.complete();
        } catch (IOException e) {
            if (sink.isCancelled()) {
                log.debug("[ResponsesApi] stream closed after cancellation: {}", e.getMessage());
                return;
            }
            sink.error(new LlmCallFailedException(ErrorSource.NETWORK,
                    "Responses API request failed: " + e.getMessage(), e));
        }
    }

    private void readEvents(BufferedSource source, FluxSink<Map<String, Object>> sink) throws IOException {
        StringBuilder data = new StringBuilder();
        String line;
        while (!sink.isCancelled() && (line = source.readUtf8Line()) != null) {
            if (line.isEmpty()) {
                dispatch(data, sink);
                data.setLength(0);
            } else if (line.startsWith(DATA_PREFIX)) {
                if (data.length() > 0) {
                    data.append('\n');
                }
                data.append(line.substring(DATA_PREFIX.length()).stripLeading());
            }
        }
        dispatch(data, sink);
    }

    private void dispatch(StringBuilder data, FluxSink<Map<String, Object>> sink) {
        String frame = data.toString().trim();
        if (frame.isEmpty() || DONE_SENTINEL.equals(frame)) {
            return;
        }
        try {
            sink.next(objectMapper.readValue(frame, EVENT_TYPE));
        } catch (JsonProcessingException e) {
            log.warn("[ResponsesApi] dropping malformed stream frame: {}", e.getOriginalMessage());
        }
    }

    private String buildUrl() {
        String baseUrl = properties.getLlm().getApiUrl();
        if (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        return baseUrl + "/responses";
    }

    private static String truncate(String value) {
        if (value == null) {
            return "";
        }
        return value.length() > MAX_ERROR_BODY_LENGTH ? value.substring(0, MAX_ERROR_BODY_LENGTH) + "..." : value;
    }
}
