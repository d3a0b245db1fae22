package me.golemcore.orchestrator.domain.model;

import java.util.List;

/**
 * Everything one LLM call is built from, captured from the conversation state
 * when the call starts.
 *
 * @param taskId
 *            conversation id
 * @param agentId
 *            agent the conversation belongs to
 * @param messages
 *            full message log
 * @param toolConfig
 *            tools loaded at initialization
 * @param modelConfig
 *            model loaded at initialization
 * @param previousResponseId
 *            continuation token, {@code null} before the first call
 * @param approvalDecision
 *            decision to send instead of messages, or {@code null}
 */
public record TurnContext(
        String taskId,
        String agentId,
        List<Message> messages,
        List<ToolDescriptor> toolConfig,
        ModelConfig modelConfig,
        String previousResponseId,
        ApprovalDecision approvalDecision) {

    public static TurnContext forMessages(ConversationState state) {
        return new TurnContext(state.getTaskId(), state.getAgentId(), state.getMessages(), state.getToolConfig(),
                state.getModelConfig(), state.getLastResponseId(), null);
    }

    public static TurnContext forApproval(ConversationState state, ApprovalDecision decision) {
        return new TurnContext(state.getTaskId(), state.getAgentId(), state.getMessages(), state.getToolConfig(),
                state.getModelConfig(), decision.continuationToken(), decision);
    }

    public boolean isApprovalContinuation() {
        return approvalDecision != null;
    }
}
