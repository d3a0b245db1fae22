package me.golemcore.orchestrator.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Agent configuration as returned by the agent configuration source.
 */
@Value
@Builder
public class AgentProfile {

    String agentId;
    String model;
    String reasoningEffort;
    String instructions;
}
