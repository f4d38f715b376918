package com.phillippitts.agentcore.exception;

/**
 * Thrown when a provider cannot be used because its readiness preparation failed
 * or has not completed in time.
 */
public class BackendNotReadyException extends AgentCoreException {

    private final String family;
    private final String backendId;
    private final String reason;

    public BackendNotReadyException(String family, String backendId, String reason) {
        super(family + " backend '" + backendId + "' is not ready: " + reason);
        this.family = family;
        this.backendId = backendId;
        this.reason = reason;
    }

    public BackendNotReadyException(String family, String backendId, String reason, Throwable cause) {
        super(family + " backend '" + backendId + "' is not ready: " + reason, cause);
        this.family = family;
        this.backendId = backendId;
        this.reason = reason;
    }

    public String getFamily() {
        return family;
    }

    public String getBackendId() {
        return backendId;
    }

    public String getReason() {
        return reason;
    }
}
