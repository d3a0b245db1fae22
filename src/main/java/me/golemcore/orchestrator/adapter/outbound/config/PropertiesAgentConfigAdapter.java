package me.golemcore.orchestrator.adapter.outbound.config;

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
import me.golemcore.orchestrator.domain.model.AgentProfile;
import me.golemcore.orchestrator.domain.model.ToolDescriptor;
import me.golemcore.orchestrator.infrastructure.config.OrchestratorProperties;
import me.golemcore.orchestrator.port.outbound.AgentConfigPort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Agent configuration source backed by {@code orchestrator.agents.*}
 * properties.
 *
 * <p>
 * Disabled tools are skipped. A remote tool server ({@code mcp}) without a
 * label or URL is skipped with a warning. Approval policy strings
 * {@code always} and {@code never} are passed through; any other value is
 * treated as {@code always}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PropertiesAgentConfigAdapter implements AgentConfigPort {

    private static final String APPROVAL_ALWAYS = "always";
    private static final Set<String> KNOWN_APPROVAL_POLICIES = Set.of(APPROVAL_ALWAYS, "never");

    private final OrchestratorProperties properties;

    @Override
    public Optional<AgentProfile> getAgentConfig(String agentId) {
        OrchestratorProperties.AgentProperties agent = agentId != null ? properties.getAgents().get(agentId) : null;
        if (agent == null) {
            return Optional.empty();
        }
        return Optional.of(AgentProfile.builder()
                .agentId(agentId)
                .model(agent.getModel())
                .reasoningEffort(agent.getReasoningEffort())
                .instructions(agent.getInstructions())
                .build());
    }

    @Override
    public List<ToolDescriptor> getToolConfig(String agentId) {
        OrchestratorProperties.AgentProperties agent = agentId != null ? properties.getAgents().get(agentId) : null;
        if (agent == null || agent.getTools() == null) {
            return List.of();
        }

        List<ToolDescriptor> tools = new ArrayList<>();
        for (OrchestratorProperties.ToolProperties tool : agent.getTools()) {
            if (!tool.isEnabled() || tool.getType() == null || tool.getType().isBlank()) {
                continue;
            }
            if (ToolDescriptor.TYPE_MCP.equals(tool.getType()) && !isRemoteServerComplete(tool)) {
                log.warn("[AgentConfig] skipping incomplete mcp tool for agent {}: label={}, url={}",
                        agentId, tool.getServerLabel(), tool.getServerUrl());
                continue;
            }
            tools.add(toDescriptor(tool));
        }
        return List.copyOf(tools);
    }

    private ToolDescriptor toDescriptor(OrchestratorProperties.ToolProperties tool) {
        ToolDescriptor.ToolDescriptorBuilder builder = ToolDescriptor.builder()
                .type(tool.getType())
                .config(tool.getConfig() != null ? new LinkedHashMap<>(tool.getConfig()) : Map.of());
        if (ToolDescriptor.TYPE_MCP.equals(tool.getType())) {
            builder.serverLabel(tool.getServerLabel())
                    .serverUrl(tool.getServerUrl())
                    .serverDescription(tool.getServerDescription())
                    .headers(tool.getHeaders() != null ? new LinkedHashMap<>(tool.getHeaders()) : Map.of())
                    .allowedTools(tool.getAllowedTools() != null ? List.copyOf(tool.getAllowedTools()) : List.of())
                    .requireApproval(resolveApprovalPolicy(tool.getRequireApproval()));
        }
        return builder.build();
    }

    private boolean isRemoteServerComplete(OrchestratorProperties.ToolProperties tool) {
        return tool.getServerLabel() != null && !tool.getServerLabel().isBlank()
                && tool.getServerUrl() != null && !tool.getServerUrl().isBlank();
    }

    private String resolveApprovalPolicy(String policy) {
        if (policy == null || policy.isBlank()) {
            return APPROVAL_ALWAYS;
        }
        String normalized = policy.trim().toLowerCase(Locale.ROOT);
        return KNOWN_APPROVAL_POLICIES.contains(normalized) ? normalized : APPROVAL_ALWAYS;
    }
}
