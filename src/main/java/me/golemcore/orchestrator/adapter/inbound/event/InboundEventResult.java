package me.golemcore.orchestrator.adapter.inbound.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of routing one inbound event.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class InboundEventResult {

    boolean accepted;
    String event;
    String reason;
    Object result;

    public static InboundEventResult accepted(String event, Object result) {
        return InboundEventResult.builder().accepted(true).event(event).result(result).build();
    }

    public static InboundEventResult ignored(String event, String reason) {
        return InboundEventResult.builder().accepted(false).event(event).reason(reason).build();
    }
}
