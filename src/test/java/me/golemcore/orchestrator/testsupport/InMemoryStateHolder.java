package me.golemcore.orchestrator.testsupport;

import me.golemcore.orchestrator.domain.model.ConversationState;
import me.golemcore.orchestrator.domain.model.ResponseEvent;
import me.golemcore.orchestrator.domain.service.ConversationStateHolder;
import me.golemcore.orchestrator.domain.service.EventTransition;
import me.golemcore.orchestrator.domain.service.ResponseEventProcessor;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Single-threaded state holder for handler tests. Live events are collected
 * instead of published.
 */
public final class InMemoryStateHolder implements ConversationStateHolder {

    private final ResponseEventProcessor processor = new ResponseEventProcessor();
    private final List<ResponseEvent> liveEvents = new ArrayList<>();

    private ConversationState state;
    private boolean endRequested;

    public InMemoryStateHolder(ConversationState state) {
        this.state = state;
    }

    @Override
    public ConversationState current() {
        return state;
    }

    @Override
    public ConversationState update(UnaryOperator<ConversationState> transition) {
        state = transition.apply(state);
        return state;
    }

    @Override
    public void process(ResponseEvent event) {
        EventTransition transition = processor.process(state, event);
        state = transition.state();
        liveEvents.addAll(transition.liveEvents());
    }

    @Override
    public boolean isEndRequested() {
        return endRequested;
    }

    public void requestEnd() {
        endRequested = true;
    }

    public List<ResponseEvent> getLiveEvents() {
        return liveEvents;
    }
}
