package com.phillippitts.agentcore.exception;

/**
 * Thrown during readiness preparation when a provider's model or binary is missing
 * and could not be fetched.
 */
public class ModelNotFoundException extends AgentCoreException {

    private final String modelPath;

    public ModelNotFoundException(String modelPath) {
        super("Model not found at path: " + modelPath);
        this.modelPath = modelPath;
    }

    public ModelNotFoundException(String modelPath, Throwable cause) {
        super("Model not found at path: " + modelPath, cause);
        this.modelPath = modelPath;
    }

    public String getModelPath() {
        return modelPath;
    }
}
