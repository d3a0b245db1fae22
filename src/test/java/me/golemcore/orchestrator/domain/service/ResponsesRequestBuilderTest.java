package me.golemcore.orchestrator.domain.service;

import me.golemcore.orchestrator.domain.model.ApprovalDecision;
import me.golemcore.orchestrator.domain.model.ConversationState;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.domain.model.ModelConfig;
import me.golemcore.orchestrator.domain.model.ResponsesRequest;
import me.golemcore.orchestrator.domain.model.ToolDescriptor;
import me.golemcore.orchestrator.domain.model.TurnContext;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResponsesRequestBuilderTest {

    private OrchestratorProperties properties;
    private ResponsesRequestBuilder builder;

    @BeforeEach
    void setUp() {
        properties = new OrchestratorProperties();
        builder = new ResponsesRequestBuilder(properties);
    }

    @Test
    void shouldBuildStreamingRequestFromMessages() {
        TurnContext context = new TurnContext("task-1", "agent-1",
                List.of(Message.developer("Be brief"), Message.user("Hi")),
                List.of(), ModelConfig.builder().model("gpt-5-mini").reasoningEffort("low").build(),
                null, null);

        ResponsesRequest request = builder.build(context);

        assertEquals("gpt-5-mini", request.getModel());
        assertEquals(List.of(
                Map.of("role", "developer", "content", "Be brief"),
                Map.of("role", "user", "content", "Hi")), request.getInput());
        assertEquals("auto", request.getToolChoice());
        assertEquals("low", request.getReasoning().getEffort());
        assertEquals("detailed", request.getReasoning().getSummary());
        assertEquals(Map.of("type", "text"), request.getText().getFormat());
        assertEquals("low", request.getText().getVerbosity());
        assertTrue(request.isStream());
        assertTrue(request.isParallelToolCalls());
        assertNull(request.getPreviousResponseId());
        assertNull(request.getTools());
        assertNull(request.getContextManagement());
    }

    @Test
    void shouldFallBackToConfiguredModelDefaults() {
        properties.getLlm().setDefaultModel("gpt-5-nano");
        properties.getLlm().setDefaultReasoningEffort("medium");

        ResponsesRequest request = builder.build(new TurnContext("task-1", "agent-1", List.of(), List.of(),
                null, null, null));

        assertEquals("gpt-5-nano", request.getModel());
        assertEquals("medium", request.getReasoning().getEffort());
    }

    @Test
    void shouldSendContinuationTokenAndTools() {
        ToolDescriptor search = ToolDescriptor.builder().type(ToolDescriptor.TYPE_WEB_SEARCH).build();
        TurnContext context = new TurnContext("task-1", "agent-1", List.of(Message.user("Hi")),
                List.of(search), ModelConfig.builder().model("gpt-5").build(), "resp_1", null);

        ResponsesRequest request = builder.build(context);

        assertEquals("resp_1", request.getPreviousResponseId());
        assertEquals(List.of(Map.of("type", "web_search_preview")), request.getTools());
    }

    @Test
    void shouldAddCompactionWhenThresholdConfigured() {
        properties.getLlm().setCompactThreshold(200000);

        ResponsesRequest request = builder.build(new TurnContext("task-1", "agent-1", List.of(), List.of(),
                null, null, null));

        assertEquals(List.of(Map.of("type", "compaction", "compact_threshold", 200000)),
                request.getContextManagement());
    }

    @Test
    void shouldSendOnlyDecisionForApprovalContinuation() {
        ConversationState state = ConversationState.create("agent-1", "task-1").toBuilder()
                .messages(List.of(Message.user("Open an issue")))
                .lastResponseId("resp_2")
                .build();
        TurnContext context = TurnContext.forApproval(state, new ApprovalDecision("a1", true, "resp_1"));

        ResponsesRequest request = builder.build(context);

        assertEquals("resp_1", request.getPreviousResponseId());
        assertEquals(List.of(Map.of("type", "mcp_approval_response", "approve", true,
                "approval_request_id", "a1")), request.getInput());
    }
}
