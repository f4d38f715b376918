package com.phillippitts.agentcore.service.backend.process;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Abstraction over {@link ProcessBuilder} so process-backed providers can be tested hermetically.
 *
 * <p>Production code uses {@link DefaultProcessFactory}. Tests supply a stub returning a fake
 * {@link Process} with scripted stdout, stderr and exit behaviour.
 */
public interface ProcessFactory {

    /**
     * Starts a new process.
     *
     * @param command full command line, executable first
     * @param workingDir working directory (may be null)
     * @return started process
     * @throws IOException if the process cannot be started
     */
    Process start(List<String> command, Path workingDir) throws IOException;
}
