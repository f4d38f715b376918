package com.phillippitts.agentcore.service.backend.process;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One invocation of an external backend binary.
 *
 * @param backendId provider id, used in errors and gobbler thread names
 * @param command full command line, executable first
 * @param workingDir working directory (may be null)
 * @param stdin bytes written to the process stdin before waiting; {@code null} closes stdin immediately
 * @param timeout wall-clock limit; the process is destroyed when exceeded
 * @param maxStdoutBytes cap on captured stdout
 * @param diagnostics extra key/value pairs attached to failures (binary and model paths)
 */
public record ProcessSpec(
        String backendId,
        List<String> command,
        Path workingDir,
        byte[] stdin,
        Duration timeout,
        int maxStdoutBytes,
        Map<String, String> diagnostics
) {

    public ProcessSpec {
        Objects.requireNonNull(backendId, "backendId");
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command must not be empty");
        }
        command = List.copyOf(command);
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        if (maxStdoutBytes <= 0) {
            throw new IllegalArgumentException("maxStdoutBytes must be positive");
        }
        diagnostics = diagnostics == null ? Map.of() : Map.copyOf(diagnostics);
    }
}
