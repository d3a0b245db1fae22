package me.golemcore.orchestrator.domain.exception;

/**
 * An inbound event could not be parsed into a known shape.
 */
public class MalformedInboundEventException extends OrchestratorException {

    public MalformedInboundEventException(String message) {
        super(message);
    }

    public MalformedInboundEventException(String message, Throwable cause) {
        super(message, cause);
    }
}
