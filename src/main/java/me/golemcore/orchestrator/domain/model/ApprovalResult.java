package me.golemcore.orchestrator.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of an approval resolution. Failures are reported here instead of
 * being thrown.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApprovalResult {

    public static final String APPROVAL_NOT_FOUND = "ApprovalNotFound";
    public static final String CONVERSATION_ENDED = "ConversationEnded";
    public static final String LLM_CALL_FAILED = "LlmCallFailed";
    public static final String CONTINUATION_FAILED = "ContinuationFailed";

    String id;
    boolean approved;
    boolean processed;
    String error;
    String message;

    public static ApprovalResult processed(String id, boolean approved) {
        return ApprovalResult.builder().id(id).approved(approved).processed(true).build();
    }

    public static ApprovalResult notFound(String id, boolean approved) {
        return failed(id, approved, APPROVAL_NOT_FOUND, "Approval " + id + " is not pending");
    }

    public static ApprovalResult ended(String id, boolean approved) {
        return failed(id, approved, CONVERSATION_ENDED, "Conversation has ended");
    }

    public static ApprovalResult failed(String id, boolean approved, String error, String message) {
        return ApprovalResult.builder()
                .id(id)
                .approved(approved)
                .processed(false)
                .error(error)
                .message(message)
                .build();
    }
}
