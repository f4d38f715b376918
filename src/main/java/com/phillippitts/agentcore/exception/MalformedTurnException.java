package com.phillippitts.agentcore.exception;

/**
 * Thrown when a reasoning backend produces output that cannot be read as a turn
 * (missing action, unknown action, missing response).
 */
public class MalformedTurnException extends AgentCoreException {

    private final String rawOutput;

    public MalformedTurnException(String message, String rawOutput) {
        super(message);
        this.rawOutput = rawOutput;
    }

    public MalformedTurnException(String message, String rawOutput, Throwable cause) {
        super(message, cause);
        this.rawOutput = rawOutput;
    }

    /** Raw backend output, for diagnostics only (may contain user text). */
    public String getRawOutput() {
        return rawOutput;
    }
}
