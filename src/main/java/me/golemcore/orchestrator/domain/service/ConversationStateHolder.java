package me.golemcore.orchestrator.domain.service;

import me.golemcore.orchestrator.domain.model.ConversationState;
import me.golemcore.orchestrator.domain.model.ResponseEvent;

import java.util.function.UnaryOperator;

/**
 * Access to the state of one conversation from inside its actor. Handlers use
 * it to apply transitions; it is only ever called on the actor's execution
 * context.
 */
public interface ConversationStateHolder {

    ConversationState current();

    /**
     * Applies a pure transition and publishes the resulting state.
     *
     * @return the new state
     */
    ConversationState update(UnaryOperator<ConversationState> transition);

    /**
     * Runs one response event through the processor and forwards stream-only
     * events to the live transport.
     */
    void process(ResponseEvent event);

    /**
     * {@code true} once an end signal was received, even if the terminal
     * transition has not been applied yet.
     */
    boolean isEndRequested();
}
