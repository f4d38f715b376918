package com.phillippitts.agentcore.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link BackendOperationException} with process diagnostics.
 *
 * <pre>
 * throw BackendExceptionBuilder.create("Non-zero exit")
 *         .backend("piper")
 *         .exitCode(1)
 *         .durationMs(830)
 *         .metadata("stderr", stderrSnippet)
 *         .build();
 * </pre>
 *
 * Resulting message: {@code Non-zero exit (exitCode=1, durationMs=830, stderr=...) (backend: piper)}.
 */
public final class BackendExceptionBuilder {

    private final String message;
    private String backendId;
    private Throwable cause;
    private Integer exitCode;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private BackendExceptionBuilder(String message) {
        this.message = message;
    }

    public static BackendExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new BackendExceptionBuilder(message);
    }

    public BackendExceptionBuilder backend(String backendId) {
        this.backendId = backendId;
        return this;
    }

    public BackendExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public BackendExceptionBuilder exitCode(int exitCode) {
        this.exitCode = exitCode;
        return this;
    }

    public BackendExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /** Adds a key=value detail; null keys or values are ignored. */
    public BackendExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    public BackendOperationException build() {
        String backend = backendId != null ? backendId : "unknown";
        String detailed = detailedMessage();
        return cause != null
                ? new BackendOperationException(detailed, backend, cause)
                : new BackendOperationException(detailed, backend);
    }

    private String detailedMessage() {
        StringBuilder details = new StringBuilder();
        if (exitCode != null) {
            details.append("exitCode=").append(exitCode);
        }
        if (durationMs != null) {
            appendSeparator(details).append("durationMs=").append(durationMs);
        }
        metadata.forEach((k, v) -> appendSeparator(details).append(k).append('=').append(v));
        return details.length() == 0 ? message : message + " (" + details + ")";
    }

    private static StringBuilder appendSeparator(StringBuilder sb) {
        if (sb.length() > 0) {
            sb.append(", ");
        }
        return sb;
    }
}
