package me.golemcore.orchestrator.port.outbound;

import me.golemcore.orchestrator.domain.model.ResponseEvent;

/**
 * Sink for stream-only events shown live to observers. Delivery is best
 * effort and carries no ordering guarantee relative to persisted events.
 */
public interface LiveTransportPort {

    void publish(String taskId, ResponseEvent event);
}
