package me.golemcore.orchestrator.adapter.inbound.web.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.orchestrator.adapter.inbound.event.InboundEventRouter;
import me.golemcore.orchestrator.adapter.inbound.web.GlobalExceptionHandler;
import me.golemcore.orchestrator.adapter.inbound.web.dto.CreateConversationRequest;
import me.golemcore.orchestrator.adapter.outbound.transport.ReactorLiveTransportAdapter;
import me.golemcore.orchestrator.domain.exception.InitializationInterruptedException;
import me.golemcore.orchestrator.domain.exception.TaskOwnershipConflictException;
import me.golemcore.orchestrator.port.inbound.ConversationPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ConversationsControllerWebTest {

    private ConversationPort conversationPort;
    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        conversationPort = mock(ConversationPort.class);
        ConversationsController controller = new ConversationsController(conversationPort,
                new InboundEventRouter(conversationPort, new ObjectMapper()), new ReactorLiveTransportAdapter());

        webTestClient = WebTestClient.bindToController(controller)
                .controllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void shouldMapTaskOwnedByAnotherAgentToConflict() {
        when(conversationPort.create("agent-2", "task-1"))
                .thenThrow(new TaskOwnershipConflictException("task-1", "agent-1"));

        webTestClient.post()
                .uri("/api/conversations")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new CreateConversationRequest("agent-2", "task-1"))
                .exchange()
                .expectStatus().isEqualTo(409)
                .expectBody()
                .jsonPath("$.error").isEqualTo("TaskOwnershipConflict")
                .jsonPath("$.message").isEqualTo("Task task-1 belongs to agent agent-1");
    }

    @Test
    void shouldHideInternalIllegalStateBehindServerError() {
        when(conversationPort.snapshot("task-1"))
                .thenThrow(new IllegalStateException("Interrupted while waiting for conversation"));

        webTestClient.get()
                .uri("/api/conversations/task-1")
                .exchange()
                .expectStatus().is5xxServerError()
                .expectBody()
                .jsonPath("$.status").isEqualTo(500)
                .jsonPath("$.message").isEqualTo("Internal server error");
    }

    @Test
    void shouldReportInterruptedInitializationWaitAsServerError() {
        when(conversationPort.handleMessages(eq("task-1"), anyList()))
                .thenThrow(new InitializationInterruptedException("task-1", new InterruptedException()));

        webTestClient.post()
                .uri("/api/conversations/task-1/events/messages")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("messages", List.of(Map.of("role", "user", "content", "hi"))))
                .exchange()
                .expectStatus().is5xxServerError()
                .expectBody()
                .jsonPath("$.error").isEqualTo("InternalError");
    }
}
