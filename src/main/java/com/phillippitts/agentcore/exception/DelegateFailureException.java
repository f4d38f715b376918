package com.phillippitts.agentcore.exception;

/**
 * Raised by a delegate to report a structured, recoverable failure.
 * The invoker converts it into a failure observation; the loop keeps going.
 */
public class DelegateFailureException extends AgentCoreException {

    private final String code;

    public DelegateFailureException(String code, String message) {
        super(message);
        this.code = code == null || code.isBlank() ? "delegate_failure" : code;
    }

    public DelegateFailureException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code == null || code.isBlank() ? "delegate_failure" : code;
    }

    public String getCode() {
        return code;
    }
}
