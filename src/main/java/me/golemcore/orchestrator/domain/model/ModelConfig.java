package me.golemcore.orchestrator.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Model selection for a conversation, fixed at initialization.
 */
@Value
@Builder
public class ModelConfig {

    String model;
    String reasoningEffort;
}
