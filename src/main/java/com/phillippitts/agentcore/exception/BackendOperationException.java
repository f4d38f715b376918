package com.phillippitts.agentcore.exception;

/**
 * Thrown when a provider call (transcribe, synthesize, play) fails.
 * Prefer {@link BackendExceptionBuilder} to attach exit codes and diagnostics.
 */
public class BackendOperationException extends AgentCoreException {

    private final String backendId;

    public BackendOperationException(String message, String backendId) {
        super(message + " (backend: " + backendId + ")");
        this.backendId = backendId;
    }

    public BackendOperationException(String message, String backendId, Throwable cause) {
        super(message + " (backend: " + backendId + ")", cause);
        this.backendId = backendId;
    }

    public String getBackendId() {
        return backendId;
    }
}
