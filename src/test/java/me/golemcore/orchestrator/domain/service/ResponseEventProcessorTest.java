package me.golemcore.orchestrator.domain.service;

import me.golemcore.orchestrator.domain.model.ApprovalRequest;
import me.golemcore.orchestrator.domain.model.ConversationSnapshot;
import me.golemcore.orchestrator.domain.model.ConversationState;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.domain.model.ResponseEvent;
import me.golemcore.orchestrator.domain.model.ResponseEventKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static me.golemcore.orchestrator.testsupport.ResponseEventFixtures.approvalRequest;
import static me.golemcore.orchestrator.testsupport.ResponseEventFixtures.assistantMessageItem;
import static me.golemcore.orchestrator.testsupport.ResponseEventFixtures.completed;
import static me.golemcore.orchestrator.testsupport.ResponseEventFixtures.created;
import static me.golemcore.orchestrator.testsupport.ResponseEventFixtures.event;
import static me.golemcore.orchestrator.testsupport.ResponseEventFixtures.messageDone;
import static me.golemcore.orchestrator.testsupport.ResponseEventFixtures.textDelta;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResponseEventProcessorTest {

    private ResponseEventProcessor processor;
    private ConversationState state;

    @BeforeEach
    void setUp() {
        processor = new ResponseEventProcessor();
        state = ConversationTransitions.beginCall(ConversationState.create("agent-1", "task-1"));
    }

    @Test
    void shouldForwardDeltaWithoutPersisting() {
        ResponseEvent delta = textDelta("msg_1", 3, "Hel");

        EventTransition transition = processor.process(state, delta);

        assertSame(state, transition.state());
        assertEquals(List.of(delta), transition.liveEvents());
        assertTrue(transition.state().getEvents().isEmpty());
    }

    @Test
    void shouldTreatUnknownDeltaTypesAsStreamOnly() {
        ResponseEvent delta = event(Map.of("type", "response.audio_transcript.delta", "delta", "x"));

        EventTransition transition = processor.process(state, delta);

        assertEquals(ResponseEventKind.OTHER_DELTA, delta.getKind());
        assertEquals(1, transition.liveEvents().size());
        assertTrue(transition.state().getEvents().isEmpty());
    }

    @Test
    void shouldPersistUnknownTypesVerbatimAsOther() {
        Map<String, Object> raw = Map.of("type", "response.future_feature.done", "sequence_number", 1,
                "detail", Map.of("a", 1));

        ConversationState next = processor.process(state, event(raw)).state();

        assertEquals(1, next.getEvents().size());
        ResponseEvent persisted = next.getEvents().get(0);
        assertEquals(ResponseEventKind.OTHER, persisted.getKind());
        assertEquals(raw, persisted.getPayload());
    }

    @Test
    void shouldDropEventWithRepeatedId() {
        ResponseEvent first = event(Map.of("type", "response.in_progress", "id", "e1"));
        ResponseEvent again = event(Map.of("type", "response.in_progress", "id", "e1"));

        ConversationState afterFirst = processor.process(state, first).state();
        EventTransition second = processor.process(afterFirst, again);

        assertTrue(second.duplicate());
        assertSame(afterFirst, second.state());
        assertEquals(1, second.state().getEvents().size());
    }

    @Test
    void shouldDeduplicateRedeliveredEventsWithoutUpstreamId() {
        ConversationState next = processor.process(state, created("resp_1", 0)).state();
        ResponseEvent item = messageDone("msg_1", 4, "Hello");

        next = processor.process(next, item).state();
        EventTransition redelivered = processor.process(next, messageDone("msg_1", 4, "Hello"));

        assertTrue(redelivered.duplicate());
        assertEquals(2, redelivered.state().getEvents().size());
        assertEquals(1, redelivered.state().getMessages().size());
    }

    @Test
    void shouldOffsetUpstreamSequenceByCallBase() {
        ConversationState first = processor.process(state, created("resp_1", 0)).state();
        first = processor.process(first, messageDone("msg_1", 1, "one")).state();

        ConversationState secondCall = ConversationTransitions.beginCall(first);
        secondCall = processor.process(secondCall, created("resp_2", 0)).state();

        List<ResponseEvent> events = secondCall.getEvents();
        assertEquals(0L, events.get(0).getSequenceNumber());
        assertEquals(1L, events.get(1).getSequenceNumber());
        assertEquals(2L, events.get(2).getSequenceNumber());
    }

    @Test
    void shouldScopeIdlessEventsToTheirOwnCall() {
        ConversationState first = processor.process(state, created("resp_1", 0)).state();
        first = processor.process(first, messageDone("msg_1", 1, "one")).state();
        first = ConversationTransitions.finishCall(first);

        ConversationState secondCall = ConversationTransitions.beginCall(first);
        EventTransition error = processor.process(secondCall,
                event(Map.of("type", "error", "sequence_number", 0, "message", "upstream rejected request")));

        assertFalse(error.duplicate());
        List<ResponseEvent> events = error.state().getEvents();
        assertEquals(3, events.size());
        assertEquals("call-2:0", events.get(2).getId());
        assertTrue(events.get(2).isError());
        assertEquals(2L, events.get(2).getSequenceNumber());
    }

    @Test
    void shouldSwitchCallScopeToResponseIdOnCreated() {
        ConversationState next = processor.process(state,
                event(Map.of("type", "response.in_progress", "sequence_number", 0))).state();
        next = processor.process(next, created("resp_1", 1)).state();
        next = processor.process(next, messageDone("msg_1", 2, "Hello")).state();

        assertEquals(List.of("call-1:0", "resp_1:1", "resp_1:2"), next.getEvents().stream()
                .map(ResponseEvent::getId)
                .toList());
    }

    @Test
    void shouldSortIngestedEventAfterCompletedCall() {
        ConversationState afterCall = processor.process(state, created("resp_1", 0)).state();
        afterCall = processor.process(afterCall, messageDone("msg_1", 1, "one")).state();
        afterCall = processor.process(afterCall, event(Map.of("type", "response.in_progress",
                "sequence_number", 2))).state();
        afterCall = ConversationTransitions.finishCall(afterCall);

        ConversationState next = processor.process(afterCall, event(Map.of("type", "response.in_progress",
                "event_id", "late", "sequence_number", 0))).state();

        List<ResponseEvent> sorted = ConversationSnapshot.of(next).getEvents();
        assertEquals("late", sorted.get(sorted.size() - 1).getId());
        assertEquals(3L, sorted.get(sorted.size() - 1).getSequenceNumber());
    }

    @Test
    void shouldGiveEachIngestedIdlessEventItsOwnScope() {
        ConversationState ready = ConversationTransitions.finishCall(state);

        ConversationState next = processor.process(ready, event(Map.of("type", "response.in_progress",
                "sequence_number", 0))).state();
        EventTransition second = processor.process(next, event(Map.of("type", "response.in_progress",
                "sequence_number", 0)));

        assertFalse(second.duplicate());
        assertEquals(List.of("ingest-0:0", "ingest-1:0"), second.state().getEvents().stream()
                .map(ResponseEvent::getId)
                .toList());
    }

    @Test
    void shouldAssignLocalSequenceWhenUpstreamHasNone() {
        ConversationState next = processor.process(state, created("resp_1", 5)).state();
        next = processor.process(next, event(Map.of("type", "response.in_progress", "id", "no-seq"))).state();

        assertEquals(6L, next.getEvents().get(1).getSequenceNumber());
    }

    @Test
    void shouldSortSnapshotBySequenceRegardlessOfArrivalOrder() {
        ConversationState next = state;
        for (long seq : new long[] { 3, 1, 2 }) {
            next = processor.process(next, event(Map.of("type", "response.in_progress", "sequence_number", seq)))
                    .state();
        }

        ConversationSnapshot snapshot = ConversationSnapshot.of(next);

        assertEquals(List.of(1L, 2L, 3L), snapshot.getEvents().stream()
                .map(ResponseEvent::getSequenceNumber)
                .toList());
    }

    @Test
    void shouldUpdateLastResponseIdOnCreated() {
        ConversationState next = processor.process(state, created("resp_1", 0)).state();

        assertEquals("resp_1", next.getLastResponseId());
        assertEquals(1, next.getResponseIndex());
    }

    @Test
    void shouldKeepResponseIndexWhenSameResponseIdIsSetAgain() {
        ConversationState next = processor.process(state, created("resp_1", 0)).state();
        next = processor.process(next, event(Map.of("type", "response.created", "id", "other-event",
                "response", Map.of("id", "resp_1")))).state();

        assertEquals("resp_1", next.getLastResponseId());
        assertEquals(1, next.getResponseIndex());
        assertEquals(2, next.getEvents().size());
    }

    @Test
    void shouldAppendAssistantMessageOnceForItemAndCompletedOutput() {
        Map<String, Object> item = assistantMessageItem("msg_1", "Hello");

        ConversationState next = processor.process(state, created("resp_1", 0)).state();
        next = processor.process(next, messageDone("msg_1", 1, "Hello")).state();
        next = processor.process(next, completed("resp_1", 2, item, 10, 3)).state();

        assertEquals(List.of(Message.assistant("Hello")), next.getMessages());
    }

    @Test
    void shouldConcatenateTextParts() {
        Map<String, Object> item = Map.of(
                "id", "msg_2",
                "type", "message",
                "role", "assistant",
                "content", List.of(
                        Map.of("type", "output_text", "text", "Hello, "),
                        Map.of("type", "refusal", "refusal", "no"),
                        Map.of("type", "output_text", "text", "world")));

        ConversationState next = processor.process(state,
                event(Map.of("type", "response.output_item.done", "sequence_number", 1, "item", item))).state();

        assertEquals("Hello, world", next.getMessages().get(0).getContent());
    }

    @Test
    void shouldIgnoreNonAssistantItems() {
        Map<String, Object> item = Map.of("id", "rs_1", "type", "reasoning", "summary", List.of());

        ConversationState next = processor.process(state,
                event(Map.of("type", "response.output_item.done", "sequence_number", 1, "item", item))).state();

        assertTrue(next.getMessages().isEmpty());
        assertEquals(1, next.getEvents().size());
    }

    @Test
    void shouldRegisterApprovalRequestWithContinuationToken() {
        ConversationState next = processor.process(state, created("resp_1", 0)).state();
        next = processor.process(next, approvalRequest("response.output_item.done", "a1", 1)).state();

        ApprovalRequest pending = next.getPendingApprovals().get("a1");
        assertEquals("resp_1", pending.getContinuationToken());
        assertEquals("create_issue", pending.getToolName());
        assertEquals("github", pending.getServerLabel());
        assertEquals(ResponseEvent.STATUS_WAITING_APPROVAL, next.getEvents().get(1).getStatus());
    }

    @Test
    void shouldMarkOnlyFirstEventOfApprovalItemAsWaiting() {
        ConversationState next = processor.process(state, created("resp_1", 0)).state();
        next = processor.process(next, approvalRequest("response.output_item.added", "a1", 1)).state();
        next = processor.process(next, approvalRequest("response.output_item.done", "a1", 2)).state();

        long waiting = next.getEvents().stream()
                .filter(e -> ResponseEvent.STATUS_WAITING_APPROVAL.equals(e.getStatus()))
                .count();
        assertEquals(1, waiting);
        assertNull(next.getEvents().get(2).getStatus());
        assertEquals(1, next.getPendingApprovals().size());
    }

    @Test
    void shouldNotReRegisterResolvedApproval() {
        ConversationState next = processor.process(state, approvalRequest("response.output_item.done", "a1", 1))
                .state();
        next = ConversationTransitions.resolveApproval(next, "a1", true);

        next = processor.process(next, approvalRequest("response.output_item.done", "a1", 7)).state();

        assertFalse(next.getPendingApprovals().containsKey("a1"));
    }

    @Test
    void shouldPersistErrorEvents() {
        ConversationState next = processor.process(state,
                event(Map.of("type", "error", "sequence_number", 1, "code", "rate_limit", "message", "slow down")))
                .state();

        assertTrue(next.getEvents().get(0).isError());
    }
}
