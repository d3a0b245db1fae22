package me.golemcore.orchestrator.adapter.inbound.web.controller;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.adapter.inbound.event.InboundEventResult;
import me.golemcore.orchestrator.adapter.inbound.event.InboundEventRouter;
import me.golemcore.orchestrator.adapter.inbound.web.dto.CreateConversationRequest;
import me.golemcore.orchestrator.adapter.outbound.transport.ReactorLiveTransportAdapter;
import me.golemcore.orchestrator.domain.model.ConversationSnapshot;
import me.golemcore.orchestrator.domain.model.ResponseEvent;
import me.golemcore.orchestrator.port.inbound.ConversationPort;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.UUID;

/**
 * Host ingress for conversations: creation, inbound events, snapshots and the
 * live delta stream.
 *
 * <p>
 * Event handling blocks until the conversation actor has processed the event,
 * so it runs on the bounded elastic scheduler.
 */
@RestController
@RequestMapping("/api/conversations")
@RequiredArgsConstructor
@Slf4j
public class ConversationsController {

    private final ConversationPort conversationPort;
    private final InboundEventRouter inboundEventRouter;
    private final ReactorLiveTransportAdapter liveTransport;

    @PostMapping
    public Mono<ResponseEntity<ConversationSnapshot>> createConversation(
            @RequestBody CreateConversationRequest request) {
        if (request == null || request.getAgentId() == null || request.getAgentId().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "agent_id is required");
        }
        String taskId = request.getTaskId() != null && !request.getTaskId().isBlank()
                ? request.getTaskId()
                : UUID.randomUUID().toString();
        ConversationSnapshot snapshot = conversationPort.create(request.getAgentId(), taskId);
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(snapshot));
    }

    @GetMapping("/{taskId}")
    public Mono<ResponseEntity<ConversationSnapshot>> getSnapshot(@PathVariable String taskId) {
        return Mono.just(ResponseEntity.ok(conversationPort.snapshot(taskId)));
    }

    @PostMapping("/{taskId}/events/{eventName}")
    public Mono<ResponseEntity<InboundEventResult>> postEvent(
            @PathVariable String taskId,
            @PathVariable String eventName,
            @RequestBody(required = false) JsonNode payload) {
        return Mono.fromCallable(() -> inboundEventRouter.route(taskId, eventName, payload))
                .subscribeOn(Schedulers.boundedElastic())
                .doOnNext(result -> {
                    if (result.isAccepted() && InboundEventRouter.EVENT_END.equals(eventName)) {
                        liveTransport.close(taskId);
                    }
                })
                .map(result -> result.isAccepted()
                        ? ResponseEntity.ok(result)
                        : ResponseEntity.badRequest().body(result));
    }

    @GetMapping(value = "/{taskId}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<ResponseEvent>> streamLiveEvents(@PathVariable String taskId) {
        conversationPort.snapshot(taskId); // unknown tasks fail with 404
        return liveTransport.subscribe(taskId)
                .map(event -> ServerSentEvent.<ResponseEvent>builder()
                        .event(event.getType())
                        .data(event)
                        .build());
    }
}
