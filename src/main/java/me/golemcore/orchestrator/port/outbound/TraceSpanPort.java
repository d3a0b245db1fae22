package me.golemcore.orchestrator.port.outbound;

import me.golemcore.orchestrator.domain.model.TraceSpan;

/**
 * Fire-and-forget telemetry sink for LLM call spans. Implementations must not
 * block the caller.
 */
public interface TraceSpanPort {

    void emit(TraceSpan span);
}
