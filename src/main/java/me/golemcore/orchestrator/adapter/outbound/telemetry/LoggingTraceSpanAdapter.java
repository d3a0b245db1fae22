package me.golemcore.orchestrator.adapter.outbound.telemetry;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.orchestrator.domain.model.TraceSpan;
import me.golemcore.orchestrator.port.outbound.TraceSpanPort;
import org.springframework.stereotype.Component;

/**
 * Trace span sink that writes spans to the application log.
 */
@Component
@Slf4j
public class LoggingTraceSpanAdapter implements TraceSpanPort {

    @Override
    public void emit(TraceSpan span) {
        if (span == null) {
            return;
        }
        log.info("[Trace] {} task={} agent={} model={} response={} duration={}ms status={} tokens={}/{}",
                span.getName(), span.getTaskId(), span.getAgentId(), span.getModel(), span.getResponseId(),
                span.getDurationMs(), span.getStatus(), span.getInputTokens(), span.getOutputTokens());
    }
}
