package me.golemcore.orchestrator.domain.service;

import me.golemcore.orchestrator.domain.model.ResponseEvent;
import me.golemcore.orchestrator.domain.model.TurnContext;
import reactor.core.publisher.Flux;

/**
 * Issues exactly one model-backend call for a turn and streams its events.
 *
 * <p>
 * On failure the returned stream emits one error event and then terminates
 * with {@code LlmCallFailedException}. Implementations never retry.
 */
public interface LlmCallOrchestrator {

    Flux<ResponseEvent> call(TurnContext context);
}
