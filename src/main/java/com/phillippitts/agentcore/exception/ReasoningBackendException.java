package com.phillippitts.agentcore.exception;

/**
 * Thrown when the reasoning backend call itself fails (transport error, bad status, timeout).
 */
public class ReasoningBackendException extends AgentCoreException {

    public ReasoningBackendException(String message) {
        super(message);
    }

    public ReasoningBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
