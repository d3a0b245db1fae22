package me.golemcore.orchestrator.domain.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A human decision on a pending approval, sent to the backend in place of fresh
 * message input.
 *
 * @param approvalId
 *            id of the approval-request item
 * @param approved
 *            {@code true} to let the tool call run
 * @param continuationToken
 *            response id stored when the request was registered
 */
public record ApprovalDecision(String approvalId, boolean approved, String continuationToken) {

    public static final String TYPE = "mcp_approval_response";

    public Map<String, Object> toInputItem() {
        Map<String, Object> item = new LinkedHashMap<>();
        item.put("type", TYPE);
        item.put("approve", approved);
        item.put("approval_request_id", approvalId);
        return item;
    }
}
