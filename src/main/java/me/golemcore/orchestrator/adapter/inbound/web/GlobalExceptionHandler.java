package me.golemcore.orchestrator.adapter.inbound.web;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.adapter.inbound.web.dto.ApiErrorResponse;
import me.golemcore.orchestrator.domain.exception.ConversationEndedException;
import me.golemcore.orchestrator.domain.exception.ConversationNotFoundException;
import me.golemcore.orchestrator.domain.exception.InitializationFailedException;
import me.golemcore.orchestrator.domain.exception.InitializationTimeoutException;
import me.golemcore.orchestrator.domain.exception.TaskOwnershipConflictException;
import me.golemcore.orchestrator.domain.exception.TurnFailedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

/**
 * Centralized exception handler for conversation controllers.
 */
@ControllerAdvice(basePackages = "me.golemcore.orchestrator.adapter.inbound.web.controller")
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(ConversationNotFoundException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleNotFound(ConversationNotFoundException ex) {
        log.warn("[API] Not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, "ConversationNotFound", ex.getMessage());
    }

    @ExceptionHandler(ConversationEndedException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleEnded(ConversationEndedException ex) {
        log.warn("[API] Conversation ended: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, "ConversationEnded", ex.getMessage());
    }

    @ExceptionHandler(InitializationTimeoutException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleInitializationTimeout(InitializationTimeoutException ex) {
        log.warn("[API] {}", ex.getMessage());
        return respond(HttpStatus.GATEWAY_TIMEOUT, "InitializationTimeout", ex.getMessage());
    }

    @ExceptionHandler(InitializationFailedException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleInitializationFailed(InitializationFailedException ex) {
        log.warn("[API] Initialization failed: {}", ex.getMessage());
        return respond(HttpStatus.FAILED_DEPENDENCY, "InitializationFailed", ex.getMessage());
    }

    @ExceptionHandler(TurnFailedException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleTurnFailed(TurnFailedException ex) {
        log.warn("[API] Turn failed ({}): {}", ex.getSource().getValue(), ex.getMessage());
        return respond(HttpStatus.BAD_GATEWAY, "TurnFailed", ex.getMessage());
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        log.warn("[API] {}: {}", status, ex.getReason());
        return respond(status, status.name(), ex.getReason());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("[API] Bad request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "BadRequest", ex.getMessage());
    }

    @ExceptionHandler(TaskOwnershipConflictException.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleOwnershipConflict(TaskOwnershipConflictException ex) {
        log.warn("[API] Conflict: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, "TaskOwnershipConflict", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ApiErrorResponse>> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "InternalError", "Internal server error");
    }

    private Mono<ResponseEntity<ApiErrorResponse>> respond(HttpStatus status, String error, String message) {
        ApiErrorResponse body = ApiErrorResponse.builder()
                .status(status.value())
                .error(error)
                .message(message)
                .build();
        return Mono.just(ResponseEntity.status(status).body(body));
    }
}
