package me.golemcore.orchestrator.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Telemetry record describing one LLM call.
 */
@Value
@Builder
public class TraceSpan {

    public static final String STATUS_OK = "ok";
    public static final String STATUS_ERROR = "error";

    String name;
    String taskId;
    String agentId;
    String model;
    String responseId;
    Instant startedAt;
    long durationMs;
    String status;
    ErrorSource errorSource;
    Long inputTokens;
    Long outputTokens;
}
