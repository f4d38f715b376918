package com.phillippitts.agentcore.exception;

/**
 * Thrown when a request id is unknown or its record has been evicted.
 */
public class RequestNotFoundException extends AgentCoreException {

    private final String requestId;

    public RequestNotFoundException(String requestId) {
        super("Request not found: " + requestId);
        this.requestId = requestId;
    }

    public String getRequestId() {
        return requestId;
    }
}
