package me.golemcore.orchestrator.domain.service;

import me.golemcore.orchestrator.domain.model.ConversationState;
import me.golemcore.orchestrator.domain.model.ResponseEvent;

import java.util.List;

/**
 * Result of processing one response event: the next state plus the events to
 * hand to the live transport.
 *
 * @param state
 *            state after the event
 * @param liveEvents
 *            stream-only events to forward, never persisted
 * @param duplicate
 *            {@code true} if the event was dropped as already persisted
 */
public record EventTransition(ConversationState state, List<ResponseEvent> liveEvents, boolean duplicate) {

    public static EventTransition persisted(ConversationState state) {
        return new EventTransition(state, List.of(), false);
    }

    public static EventTransition forward(ConversationState state, ResponseEvent event) {
        return new EventTransition(state, List.of(event), false);
    }

    public static EventTransition duplicate(ConversationState state) {
        return new EventTransition(state, List.of(), true);
    }
}
