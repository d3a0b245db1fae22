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
import me.golemcore.orchestrator.domain.exception.InitializationFailedException;
import me.golemcore.orchestrator.domain.model.AgentProfile;
import me.golemcore.orchestrator.domain.model.ConversationState;
import me.golemcore.orchestrator.domain.model.Message;
import me.golemcore.orchestrator.domain.model.ModelConfig;
import me.golemcore.orchestrator.domain.model.ToolDescriptor;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.AgentConfigPort;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Loads model and tool configuration for a new conversation.
 *
 * <p>
 * Runs once per conversation. Agent instructions become a single developer
 * message at the head of the log.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ConversationInitializer {

    private static final String INSTRUCTIONS_SUFFIX = ". Markdown is supported. Use headings wherever appropriate.";

    private final AgentConfigPort agentConfigPort;
    private final OrchestratorProperties properties;

    public ConversationState initialize(ConversationState state) {
        String agentId = state.getAgentId();
        AgentProfile profile = agentConfigPort.getAgentConfig(agentId)
                .orElseThrow(() -> new InitializationFailedException("Agent with id " + agentId + " not found"));

        List<ToolDescriptor> tools;
        try {
            tools = agentConfigPort.getToolConfig(agentId);
        } catch (RuntimeException e) {
            throw new InitializationFailedException("Failed to read tools of agent " + agentId, e);
        }

        OrchestratorProperties.LlmProperties llm = properties.getLlm();
        ModelConfig modelConfig = ModelConfig.builder()
                .model(hasText(profile.getModel()) ? profile.getModel() : llm.getDefaultModel())
                .reasoningEffort(hasText(profile.getReasoningEffort())
                        ? profile.getReasoningEffort()
                        : llm.getDefaultReasoningEffort())
                .build();

        List<Message> preamble = hasText(profile.getInstructions())
                ? List.of(Message.developer(buildDeveloperPrompt(profile, state)))
                : List.of();

        log.info("[Conversation] initialized: task={}, agent={}, model={}, tools={}",
                state.getTaskId(), agentId, modelConfig.getModel(), tools != null ? tools.size() : 0);
        return ConversationTransitions.completeInitialization(state, modelConfig,
                tools != null ? tools : List.of(), preamble);
    }

    private String buildDeveloperPrompt(AgentProfile profile, ConversationState state) {
        String instructions = profile.getInstructions().strip();
        while (instructions.endsWith(".")) {
            instructions = instructions.substring(0, instructions.length() - 1);
        }
        return instructions + INSTRUCTIONS_SUFFIX
                + " Agent meta info: {agent_id: " + state.getAgentId() + ", task_id: " + state.getTaskId() + "}";
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
