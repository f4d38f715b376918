package com.phillippitts.agentcore.service.backend.process;

import com.phillippitts.agentcore.exception.BackendExceptionBuilder;
import com.phillippitts.agentcore.exception.BackendOperationException;
import com.phillippitts.agentcore.util.ProcessTimeouts;
import com.phillippitts.agentcore.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Runs external backend binaries (whisper.cpp, piper) and captures their output.
 *
 * <p>Each {@link #run(ProcessSpec)} call owns its process and gobbler threads, so one runner
 * may be shared by concurrent callers. Stdout and stderr are drained concurrently to avoid
 * pipe deadlocks; both are capped. On timeout the process is destroyed, first gracefully and
 * then forcibly.
 *
 * <p>Failures surface as {@link BackendOperationException} carrying the exit code, duration
 * and a stderr snippet.
 */
public final class ProcessRunner {

    private static final Logger LOG = LogManager.getLogger(ProcessRunner.class);

    /** Cap on captured stderr (diagnostics only). */
    public static final int STDERR_MAX_BYTES = 256 * 1024;

    /** Longest stderr excerpt attached to an error message. */
    public static final int ERROR_SNIPPET_MAX_CHARS = 2048;

    private final ProcessFactory processFactory;

    public ProcessRunner() {
        this(new DefaultProcessFactory());
    }

    public ProcessRunner(ProcessFactory processFactory) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
    }

    /**
     * Runs the process to completion.
     *
     * @return captured stdout (possibly empty, never null)
     * @throws BackendOperationException on start failure, timeout, non-zero exit or interruption
     */
    public String run(ProcessSpec spec) {
        Objects.requireNonNull(spec, "spec");
        long start = System.nanoTime();
        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();
        Process process = null;
        Thread outGobbler = null;
        Thread errGobbler = null;
        try {
            process = processFactory.start(spec.command(), spec.workingDir());
            outGobbler = startGobbler(process.getInputStream(), stdout, spec.backendId() + "-out",
                    spec.maxStdoutBytes());
            errGobbler = startGobbler(process.getErrorStream(), stderr, spec.backendId() + "-err",
                    STDERR_MAX_BYTES);
            writeStdin(process, spec.stdin());

            boolean finished = process.waitFor(spec.timeout().toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                destroyProcess(process);
                throw failure("Timeout after " + spec.timeout().toMillis() + "ms", spec, -1, stderr, start, null);
            }
            joinQuietly(outGobbler, ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
            joinQuietly(errGobbler, ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);

            int exitCode = process.exitValue();
            if (exitCode != 0) {
                throw failure("Non-zero exit: " + exitCode, spec, exitCode, stderr, start, null);
            }
            LOG.debug("{} finished in {} ms (stdout={} chars)", spec.backendId(),
                    TimeUtils.elapsedMillis(start), stdout.length());
            return stdout.toString();
        } catch (IOException e) {
            throw failure("I/O failure: " + e.getMessage(), spec, -1, stderr, start, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw failure("Interrupted", spec, -1, stderr, start, e);
        } finally {
            if (process != null && process.isAlive()) {
                destroyProcess(process);
            }
            joinQuietly(outGobbler, ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
            joinQuietly(errGobbler, ProcessTimeouts.GOBBLER_FLUSH_TIMEOUT);
        }
    }

    private static void writeStdin(Process process, byte[] stdin) throws IOException {
        try (OutputStream os = process.getOutputStream()) {
            if (stdin != null && stdin.length > 0) {
                os.write(stdin);
                os.flush();
            }
        }
    }

    private static BackendOperationException failure(String msg, ProcessSpec spec, int exitCode,
                                                     StringBuilder stderr, long start, Throwable cause) {
        String snippet;
        synchronized (stderr) {
            snippet = stderr.substring(0, Math.min(ERROR_SNIPPET_MAX_CHARS, stderr.length()));
        }
        BackendExceptionBuilder builder = BackendExceptionBuilder.create(msg)
                .backend(spec.backendId())
                .exitCode(exitCode)
                .durationMs(TimeUtils.elapsedMillis(start));
        spec.diagnostics().forEach(builder::metadata);
        if (!snippet.isEmpty()) {
            builder.metadata("stderr", snippet);
        }
        if (cause != null) {
            builder.cause(cause);
        }
        return builder.build();
    }

    private static Thread startGobbler(InputStream in, StringBuilder sink, String name, int maxBytes) {
        Thread thread = new Thread(new StreamGobbler(in, sink, name, maxBytes), name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    /**
     * Reads lines into a sink until the cap, then keeps draining without accumulating.
     */
    private static final class StreamGobbler implements Runnable {
        private final InputStream inputStream;
        private final StringBuilder sink;
        private final String name;
        private final int maxBytes;

        StreamGobbler(InputStream inputStream, StringBuilder sink, String name, int maxBytes) {
            this.inputStream = inputStream;
            this.sink = sink;
            this.name = name;
            this.maxBytes = maxBytes;
        }

        @Override
        public void run() {
            try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                boolean capReached = false;
                while ((line = br.readLine()) != null) {
                    synchronized (sink) {
                        if (sink.length() >= maxBytes) {
                            if (!capReached) {
                                LOG.warn("Stream '{}' reached {}B cap; discarding further output", name, maxBytes);
                                capReached = true;
                            }
                            continue;
                        }
                        if (!sink.isEmpty()) {
                            sink.append('\n');
                        }
                        int available = maxBytes - sink.length();
                        if (line.length() > available) {
                            sink.append(line, 0, Math.max(0, available));
                            capReached = true;
                        } else {
                            sink.append(line);
                        }
                    }
                }
            } catch (IOException e) {
                LOG.debug("Stream gobbler '{}' stopped: {}", name, e.toString());
            }
        }
    }

    private static void joinQuietly(Thread thread, Duration timeout) {
        if (thread == null) {
            return;
        }
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void destroyProcess(Process process) {
        try {
            process.destroy();
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("Process still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while destroying process");
        }
    }
}
