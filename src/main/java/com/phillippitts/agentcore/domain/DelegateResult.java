package com.phillippitts.agentcore.domain;

import java.util.Objects;

/**
 * Result of one delegate invocation. Never thrown: failures and timeouts are values that the
 * reasoning loop feeds back as observations.
 *
 * @param delegateName delegate that was invoked
 * @param success whether the delegate returned normally
 * @param text returned text on success; {@code null} on failure
 * @param failureCode failure code (e.g. {@code timeout}) on failure; {@code null} on success
 * @param failureMessage human-readable failure description on failure
 * @param durationMs wall-clock duration of the call
 */
public record DelegateResult(
        String delegateName,
        boolean success,
        String text,
        String failureCode,
        String failureMessage,
        long durationMs
) {
    public static final String CODE_TIMEOUT = "timeout";
    public static final String CODE_FAILURE = "delegate_failure";
    public static final String CODE_ERROR = "delegate_error";
    public static final String CODE_INTERRUPTED = "interrupted";

    public DelegateResult {
        Objects.requireNonNull(delegateName, "delegateName");
        if (success) {
            text = text == null ? "" : text;
        } else {
            Objects.requireNonNull(failureCode, "failureCode");
            failureMessage = failureMessage == null || failureMessage.isBlank() ? failureCode : failureMessage;
        }
    }

    public static DelegateResult success(String delegateName, String text, long durationMs) {
        return new DelegateResult(delegateName, true, text, null, null, durationMs);
    }

    public static DelegateResult failure(String delegateName, String code, String message, long durationMs) {
        return new DelegateResult(delegateName, false, null, code, message, durationMs);
    }

    public boolean isTimeout() {
        return !success && CODE_TIMEOUT.equals(failureCode);
    }

    /**
     * Renders this result as the observation text for the next reasoning turn.
     */
    public String toObservation() {
        if (success) {
            return text;
        }
        return "Error executing " + delegateName + " [" + failureCode + "]: " + failureMessage;
    }
}
