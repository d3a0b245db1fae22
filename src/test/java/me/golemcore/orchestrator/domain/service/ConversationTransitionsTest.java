package me.golemcore.orchestrator.domain.service;

import me.golemcore.orchestrator.domain.model.ApprovalRequest;
import me.golemcore.orchestrator.domain.model.ConversationPhase;
import me.golemcore.orchestrator.domain.model.ConversationState;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.domain.model.ModelConfig;
import me.golemcore.orchestrator.domain.model.ResponseEvent;
import me.golemcore.orchestrator.domain.model.Subtask;
import me.golemcore.orchestrator.domain.model.SubtaskNotification;
import me.golemcore.orchestrator.domain.model.Todo;
import me.golemcore.orchestrator.domain.model.ToolDescriptor;
import org.junit.jupiter.api.Test;

import java.util.List;

import static me.golemcore.orchestrator.testsupport.ResponseEventFixtures.approvalRequest;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConversationTransitionsTest {

    private static final ModelConfig MODEL = ModelConfig.builder().model("gpt-5").reasoningEffort("low").build();

    @Test
    void shouldMoveThroughInitializationOnce() {
        ConversationState state = ConversationState.create("agent-1", "task-1");

        ConversationState initializing = ConversationTransitions.beginInitialization(state);
        ConversationState ready = ConversationTransitions.completeInitialization(initializing, MODEL,
                List.of(ToolDescriptor.builder().type("web_search_preview").build()),
                List.of(Message.developer("Be brief")));
        ConversationState again = ConversationTransitions.completeInitialization(ready,
                ModelConfig.builder().model("other").build(), List.of(), List.of(Message.developer("ignored")));

        assertEquals(ConversationPhase.INITIALIZING, initializing.getPhase());
        assertEquals(ConversationPhase.READY, ready.getPhase());
        assertTrue(ready.isInitialized());
        assertEquals(1, ready.getToolConfig().size());
        assertSame(ready, again);
        assertEquals("gpt-5", again.getModelConfig().getModel());
    }

    @Test
    void shouldCycleBetweenReadyAndProcessing() {
        ConversationState ready = ConversationTransitions.completeInitialization(
                ConversationState.create("agent-1", "task-1"), MODEL, List.of(), List.of());

        ConversationState processing = ConversationTransitions.beginCall(ready);
        ConversationState back = ConversationTransitions.finishCall(processing);

        assertEquals(ConversationPhase.PROCESSING, processing.getPhase());
        assertEquals(ConversationPhase.READY, back.getPhase());
    }

    @Test
    void shouldStayEndedWhenCallFinishesAfterEnd() {
        ConversationState processing = ConversationTransitions.beginCall(
                ConversationState.create("agent-1", "task-1"));

        ConversationState ended = ConversationTransitions.end(processing);
        ConversationState afterFinish = ConversationTransitions.finishCall(ended);

        assertEquals(ConversationPhase.ENDED, afterFinish.getPhase());
        assertTrue(afterFinish.isEnded());
    }

    @Test
    void shouldIgnoreSameResponseId() {
        ConversationState state = ConversationTransitions.updateLastResponseId(
                ConversationState.create("agent-1", "task-1"), "resp_1");

        assertSame(state, ConversationTransitions.updateLastResponseId(state, "resp_1"));
        assertSame(state, ConversationTransitions.updateLastResponseId(state, null));
    }

    @Test
    void shouldResolveApprovalExactlyOnce() {
        ConversationState state = ConversationState.create("agent-1", "task-1");
        ResponseEvent waiting = approvalRequest("response.output_item.done", "a1", 0)
                .toBuilder()
                .id("evt-a1")
                .sequenceNumber(0L)
                .status(ResponseEvent.STATUS_WAITING_APPROVAL)
                .build();
        state = ConversationTransitions.appendEvent(state, waiting);
        state = ConversationTransitions.registerApproval(state,
                ApprovalRequest.builder().id("a1").continuationToken("resp_1").build());

        ConversationState denied = ConversationTransitions.resolveApproval(state, "a1", false);
        ConversationState again = ConversationTransitions.resolveApproval(denied, "a1", true);

        assertFalse(denied.getPendingApprovals().containsKey("a1"));
        assertEquals(ResponseEvent.STATUS_FAILED, denied.getEvents().get(0).getStatus());
        assertSame(denied, again);
    }

    @Test
    void shouldStartEachCallInItsOwnScope() {
        ConversationState first = ConversationTransitions.beginCall(ConversationState.create("agent-1", "task-1"));
        ConversationState named = ConversationTransitions.enterResponseScope(first, "resp_1");
        ConversationState second = ConversationTransitions.beginCall(ConversationTransitions.finishCall(named));

        assertEquals("call-1", first.getCallScope());
        assertEquals("resp_1", named.getCallScope());
        assertEquals("call-2", second.getCallScope());
        ConversationState ready = ConversationTransitions.finishCall(second);
        assertSame(ready, ConversationTransitions.enterResponseScope(ready, "resp_2"));
    }

    @Test
    void shouldReplaceTodosAndAppendProgressMessage() {
        ConversationState state = ConversationState.create("agent-1", "task-1");
        state = ConversationTransitions.replaceTodos(state, List.of(
                Todo.builder().id("1").content("Old step").status(Todo.STATUS_IN_PROGRESS).build()));

        ConversationState next = ConversationTransitions.replaceTodos(state, List.of(
                Todo.builder().id("1").content("Read logs").status(Todo.STATUS_COMPLETED).build(),
                Todo.builder().id("2").content("Fix bug").status(Todo.STATUS_IN_PROGRESS).build(),
                Todo.builder().id("1").content("Read all logs").status(Todo.STATUS_COMPLETED).build()));

        assertEquals(List.of("1", "2"), next.getTodos().stream().map(Todo::getId).toList());
        assertEquals("Read all logs", next.getTodos().get(0).getContent());
        assertEquals(2, next.getMessages().size());
        Message progress = next.getMessages().get(1);
        assertEquals(Message.ROLE_DEVELOPER, progress.getRole());
        assertEquals("Progress: 1/2 completed, 1 in progress\n\n[x] Read all logs\n[ ] Fix bug\n"
                + "\nUpdate status as you complete steps using updatetodos.", progress.getContent());
    }

    @Test
    void shouldClearTodosWithoutProgressMessage() {
        ConversationState state = ConversationTransitions.replaceTodos(ConversationState.create("agent-1", "task-1"),
                List.of(Todo.builder().id("1").content("Step").status(Todo.STATUS_COMPLETED).build()));

        ConversationState cleared = ConversationTransitions.replaceTodos(state, List.of());

        assertTrue(cleared.getTodos().isEmpty());
        assertEquals(state.getMessages(), cleared.getMessages());
    }

    @Test
    void shouldTrackSubtaskStatusAndFailureMessage() {
        ConversationState state = ConversationTransitions.registerSubtask(ConversationState.create("agent-1", "task-1"),
                Subtask.builder().taskId("child-1").title("Triage").status(Subtask.STATUS_IN_PROGRESS).build());

        ConversationState failed = ConversationTransitions.applySubtaskStatus(state, SubtaskNotification.builder()
                .taskId("child-1").status(Subtask.STATUS_FAILED).message("quota exceeded").build());
        ConversationState unknown = ConversationTransitions.applySubtaskStatus(failed, SubtaskNotification.builder()
                .taskId("child-9").status(Subtask.STATUS_COMPLETED).build());

        Subtask child = failed.getSubtasks().get("child-1");
        assertEquals(Subtask.STATUS_FAILED, child.getStatus());
        assertEquals("quota exceeded", child.getError());
        assertEquals("Triage", child.getTitle());
        assertSame(failed, unknown);
    }

    @Test
    void shouldNotMutateInputState() {
        ConversationState state = ConversationState.create("agent-1", "task-1");

        ConversationTransitions.appendMessages(state, List.of(Message.user("Hi")));

        assertTrue(state.getMessages().isEmpty());
    }
}
