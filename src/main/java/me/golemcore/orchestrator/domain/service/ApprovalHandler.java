package me.golemcore.orchestrator.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.exception.LlmCallFailedException;
import me.golemcore.orchestrator.domain.model.ApprovalDecision;
import me.golemcore.orchestrator.domain.model.ApprovalRequest;
import me.golemcore.orchestrator.domain.model.ApprovalResult;
import org.springframework.stereotype.Component;

/**
 * Entry point for human approval decisions.
 *
 * <p>
 * A pending approval is resumed with one continuation call built from the
 * stored continuation token and the decision. Only after that call has been
 * fully processed is the approval removed from the registry and its event
 * moved to a terminal status. Every failure is returned in the
 * {@link ApprovalResult}; nothing is thrown.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ApprovalHandler {

    private final TurnExecutor turnExecutor;

    public ApprovalResult resolve(ConversationStateHolder holder, String approvalId, boolean approved) {
        String taskId = holder.current().getTaskId();
        ApprovalRequest pending = approvalId != null
                ? holder.current().getPendingApprovals().get(approvalId)
                : null;
        if (pending == null) {
            log.warn("[Approval] no pending approval {}: task={}", approvalId, taskId);
            return ApprovalResult.notFound(approvalId, approved);
        }

        log.info("[Approval] resolving {} (approved={}, tool={}): task={}",
                approvalId, approved, pending.getToolName(), taskId);
        ApprovalDecision decision = new ApprovalDecision(approvalId, approved, pending.getContinuationToken());
        try {
            turnExecutor.execute(holder, decision);
        } catch (RuntimeException e) { // NOSONAR - a human decision must never crash the conversation
            log.error("[Approval] continuation for {} failed, approval stays pending: task={}: {}",
                    approvalId, taskId, e.getMessage(), e);
            String error = e instanceof LlmCallFailedException
                    ? ApprovalResult.LLM_CALL_FAILED
                    : ApprovalResult.CONTINUATION_FAILED;
            return ApprovalResult.failed(approvalId, approved, error, e.getMessage());
        }

        holder.update(state -> ConversationTransitions.resolveApproval(state, approvalId, approved));
        log.info("[Approval] {} {}: task={}", approvalId, pending.resolve(approved).getStatus().toValue(), taskId);
        return ApprovalResult.processed(approvalId, approved);
    }
}
