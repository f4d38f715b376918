package com.phillippitts.agentcore.exception;

/**
 * Thrown when an operation names a provider id that is not registered.
 */
public class UnknownBackendException extends AgentCoreException {

    private final String family;
    private final String backendId;

    public UnknownBackendException(String family, String backendId) {
        super("Unknown " + family + " backend: " + backendId);
        this.family = family;
        this.backendId = backendId;
    }

    public String getFamily() {
        return family;
    }

    public String getBackendId() {
        return backendId;
    }
}
