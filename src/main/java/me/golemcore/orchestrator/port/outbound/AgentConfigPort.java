package me.golemcore.orchestrator.port.outbound;

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

import me.golemcore.orchestrator.domain.model.AgentProfile;
import me.golemcore.orchestrator.domain.model.ToolDescriptor;

import java.util.List;
import java.util.Optional;

/**
 * Port for reading agent definitions. Called once per conversation during
 * initialization.
 */
public interface AgentConfigPort {

    /**
     * Returns model and instructions of the agent, or empty if the agent is
     * unknown.
     */
    Optional<AgentProfile> getAgentConfig(String agentId);

    /**
     * Returns the tools enabled for the agent, in declaration order.
     */
    List<ToolDescriptor> getToolConfig(String agentId);
}
