package me.golemcore.orchestrator.adapter.inbound.web;

import me.golemcore.orchestrator.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.orchestrator.domain.exception.ConversationEndedException;
import me.golemcore.orchestrator.domain.exception.ConversationNotFoundException;
import me.golemcore.orchestrator.domain.exception.InitializationFailedException;
import me.golemcore.orchestrator.domain.exception.InitializationTimeoutException;
import me.golemcore.orchestrator.domain.exception.TaskOwnershipConflictException;
import me.golemcore.orchestrator.domain.exception.TurnFailedException;
import me.golemcore.orchestrator.domain.model.ErrorSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void shouldMapNotFoundTo404() {
        assertResponse(handler.handleNotFound(new ConversationNotFoundException("task-1")),
                HttpStatus.NOT_FOUND, "ConversationNotFound");
    }

    @Test
    void shouldMapEndedTo409() {
        assertResponse(handler.handleEnded(new ConversationEndedException("task-1")),
                HttpStatus.CONFLICT, "ConversationEnded");
    }

    @Test
    void shouldMapOwnershipConflictTo409() {
        assertResponse(handler.handleOwnershipConflict(new TaskOwnershipConflictException("task-1", "agent-1")),
                HttpStatus.CONFLICT, "TaskOwnershipConflict");
    }

    @Test
    void shouldMapInitializationTimeoutTo504() {
        assertResponse(handler.handleInitializationTimeout(
                new InitializationTimeoutException("task-1", Duration.ofSeconds(60))),
                HttpStatus.GATEWAY_TIMEOUT, "InitializationTimeout");
    }

    @Test
    void shouldMapInitializationFailureTo424() {
        assertResponse(handler.handleInitializationFailed(
                new InitializationFailedException("Agent with id x not found")),
                HttpStatus.FAILED_DEPENDENCY, "InitializationFailed");
    }

    @Test
    void shouldMapTurnFailureTo502() {
        assertResponse(handler.handleTurnFailed(new TurnFailedException(ErrorSource.BACKEND, "Turn 1 failed",
                new IllegalStateException("boom"))), HttpStatus.BAD_GATEWAY, "TurnFailed");
    }

    @Test
    void shouldKeepResponseStatus() {
        StepVerifier.create(handler.handleResponseStatus(
                new ResponseStatusException(HttpStatus.BAD_REQUEST, "agent_id is required")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
                    assertEquals("agent_id is required", response.getBody().getMessage());
                })
                .verifyComplete();
    }

    @Test
    void shouldHideInternalErrorDetails() {
        StepVerifier.create(handler.handleGeneric(new RuntimeException("secret detail")))
                .assertNext(response -> {
                    assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
                    assertEquals("Internal server error", response.getBody().getMessage());
                })
                .verifyComplete();
    }

    private static void assertResponse(Mono<ResponseEntity<ApiErrorResponse>> mono, HttpStatus status,
            String error) {
        StepVerifier.create(mono)
                .assertNext(response -> {
                    assertEquals(status, response.getStatusCode());
                    ApiErrorResponse body = response.getBody();
                    assertNotNull(body);
                    assertEquals(status.value(), body.getStatus());
                    assertEquals(error, body.getError());
                })
                .verifyComplete();
    }
}
