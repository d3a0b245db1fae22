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
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.domain.model.ModelConfig;
import me.golemcore.orchestrator.domain.model.ResponsesRequest;
import me.golemcore.orchestrator.domain.model.ToolDescriptor;
import me.golemcore.orchestrator.domain.model.TurnContext;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the single outbound request of a turn.
 *
 * <p>
 * A message turn sends the full message log as input; an approval
 * continuation sends only the decision object. The continuation token, tools
 * and model come from the turn context. When a compaction threshold is
 * configured the request carries a {@code context_management} directive so the
 * backend can shrink history server-side.
 */
@Component
@RequiredArgsConstructor
public class ResponsesRequestBuilder {

    private static final String TOOL_CHOICE_AUTO = "auto";
    private static final String COMPACTION_TYPE = "compaction";

    private final OrchestratorProperties properties;

    public ResponsesRequest build(TurnContext context) {
        OrchestratorProperties.LlmProperties llm = properties.getLlm();
        ModelConfig modelConfig = context.modelConfig();

        String model = modelConfig != null && hasText(modelConfig.getModel())
                ? modelConfig.getModel()
                : llm.getDefaultModel();
        String effort = modelConfig != null && hasText(modelConfig.getReasoningEffort())
                ? modelConfig.getReasoningEffort()
                : llm.getDefaultReasoningEffort();

        ResponsesRequest.ResponsesRequestBuilder builder = ResponsesRequest.builder()
                .model(model)
                .input(buildInput(context))
                .toolChoice(TOOL_CHOICE_AUTO)
                .reasoning(ResponsesRequest.Reasoning.builder()
                        .effort(effort)
                        .summary(llm.getReasoningSummary())
                        .build())
                .text(ResponsesRequest.Text.builder()
                        .format(Map.of("type", "text"))
                        .verbosity(llm.getVerbosity())
                        .build())
                .parallelToolCalls(true)
                .stream(true);

        if (hasText(context.previousResponseId())) {
            builder.previousResponseId(context.previousResponseId());
        }

        List<ToolDescriptor> tools = context.toolConfig();
        if (tools != null && !tools.isEmpty()) {
            builder.tools(tools.stream().map(ToolDescriptor::toRequestPayload).toList());
        }

        int threshold = llm.getCompactThreshold();
        if (threshold > 0) {
            Map<String, Object> compaction = new LinkedHashMap<>();
            compaction.put("type", COMPACTION_TYPE);
            compaction.put("compact_threshold", threshold);
            builder.contextManagement(List.of(compaction));
        }

        return builder.build();
    }

    private List<Object> buildInput(TurnContext context) {
        if (context.isApprovalContinuation()) {
            return List.of(context.approvalDecision().toInputItem());
        }
        List<Object> input = new ArrayList<>();
        if (context.messages() != null) {
            for (Message message : context.messages()) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("role", message.getRole());
                entry.put("content", message.getContent() != null ? message.getContent() : "");
                input.add(entry);
            }
        }
        return input;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
