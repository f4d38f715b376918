package com.phillippitts.agentcore.exception;

/**
 * Base exception for all agent-core application errors.
 * All domain exceptions extend this class so the REST boundary can map them in one place.
 */
public class AgentCoreException extends RuntimeException {

    public AgentCoreException(String message) {
        super(message);
    }

    public AgentCoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public AgentCoreException(Throwable cause) {
        super(cause);
    }
}
