package me.golemcore.orchestrator.port.outbound;

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

import me.golemcore.orchestrator.domain.model.ResponsesRequest;
import reactor.core.publisher.Flux;

import java.util.Map;

/**
 * Port for the model backend's streaming responses endpoint.
 */
public interface ResponsesApiPort {

    /**
     * Issues one streaming call and emits every raw event as a JSON map, in
     * arrival order. Failures surface as {@code LlmCallFailedException} with
     * the matching source. Implementations must not retry.
     */
    Flux<Map<String, Object>> stream(ResponsesRequest request);

    /**
     * Checks if the backend is configured.
     */
    boolean isAvailable();
}
