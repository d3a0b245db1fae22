package me.golemcore.orchestrator.adapter.outbound.transport;

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
import me.golemcore.orchestrator.domain.model.ResponseEvent;
import me.golemcore.orchestrator.port.outbound.LiveTransportPort;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live transport backed by one Reactor multicast sink per task.
 *
 * <p>
 * Events published while nobody is subscribed are dropped. Slow subscribers
 * lose events instead of slowing down the conversation.
 */
@Component
@Slf4j
public class ReactorLiveTransportAdapter implements LiveTransportPort {

    private final Map<String, Sinks.Many<ResponseEvent>> sinks = new ConcurrentHashMap<>();

    @Override
    public void publish(String taskId, ResponseEvent event) {
        Sinks.Many<ResponseEvent> sink = sinks.get(taskId);
        if (sink == null) {
            return;
        }
        Sinks.EmitResult result = sink.tryEmitNext(event);
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.debug("[LiveTransport] event {} not delivered for task {}: {}", event.getType(), taskId, result);
        }
    }

    /**
     * Subscribes to the live events of a task.
     */
    public Flux<ResponseEvent> subscribe(String taskId) {
        return sinkFor(taskId).asFlux();
    }

    /**
     * Completes the stream of a task and forgets its sink.
     */
    public void close(String taskId) {
        Sinks.Many<ResponseEvent> sink = sinks.remove(taskId);
        if (sink != null) {
            sink.tryEmitComplete();
        }
    }

    private Sinks.Many<ResponseEvent> sinkFor(String taskId) {
        return sinks.computeIfAbsent(taskId, id -> Sinks.many().multicast().directBestEffort());
    }
}
