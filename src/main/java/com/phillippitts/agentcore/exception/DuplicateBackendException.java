package com.phillippitts.agentcore.exception;

/**
 * Thrown when a provider id is registered twice in the same registry.
 */
public class DuplicateBackendException extends AgentCoreException {

    private final String backendId;

    public DuplicateBackendException(String family, String backendId) {
        super("Duplicate " + family + " backend id: " + backendId);
        this.backendId = backendId;
    }

    public String getBackendId() {
        return backendId;
    }
}
