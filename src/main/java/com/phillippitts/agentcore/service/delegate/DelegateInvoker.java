package com.phillippitts.agentcore.service.delegate;

import com.phillippitts.agentcore.domain.DelegateResult;
import com.phillippitts.agentcore.exception.DelegateFailureException;
import com.phillippitts.agentcore.service.metrics.OrchestrationMetricsPublisher;
import com.phillippitts.agentcore.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one delegate call on the delegate executor and races it against a timeout.
 *
 * <p>Never throws: every outcome, including timeouts and unexpected exceptions, comes back as a
 * {@link DelegateResult}. A timed-out call is cancelled with interruption and abandoned.
 */
public class DelegateInvoker {

    private static final Logger LOG = LogManager.getLogger(DelegateInvoker.class);

    private final Executor executor;
    private final OrchestrationMetricsPublisher metrics;

    public DelegateInvoker(Executor executor, OrchestrationMetricsPublisher metrics) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.metrics = metrics != null ? metrics : OrchestrationMetricsPublisher.NOOP;
    }

    /**
     * @param timeout call limit; null, zero or negative waits without limit
     */
    public DelegateResult invoke(Delegate delegate, Map<String, Object> arguments, Duration timeout) {
        Objects.requireNonNull(delegate, "delegate");
        Map<String, Object> args = arguments == null ? Map.of() : arguments;
        String name = delegate.name();
        long start = System.nanoTime();
        FutureTask<String> task = new FutureTask<>(() -> delegate.invoke(args));
        DelegateResult result;
        try {
            executor.execute(task);
            String text = hasLimit(timeout)
                    ? task.get(timeout.toMillis(), TimeUnit.MILLISECONDS)
                    : task.get();
            result = DelegateResult.success(name, text, TimeUtils.elapsedMillis(start));
        } catch (TimeoutException e) {
            task.cancel(true);
            result = DelegateResult.failure(name, DelegateResult.CODE_TIMEOUT,
                    "Timed out after " + timeout.toMillis() + " ms", TimeUtils.elapsedMillis(start));
        } catch (ExecutionException e) {
            result = fromCause(name, e.getCause(), TimeUtils.elapsedMillis(start));
        } catch (InterruptedException e) {
            task.cancel(true);
            Thread.currentThread().interrupt();
            result = DelegateResult.failure(name, DelegateResult.CODE_INTERRUPTED,
                    "Interrupted while waiting for " + name, TimeUtils.elapsedMillis(start));
        } catch (RejectedExecutionException e) {
            result = DelegateResult.failure(name, DelegateResult.CODE_ERROR,
                    "Delegate executor rejected the call: " + e.getMessage(), TimeUtils.elapsedMillis(start));
        }

        String outcome = result.success() ? "success" : result.failureCode();
        metrics.recordDelegateCall(name, outcome, result.durationMs());
        if (result.success()) {
            LOG.debug("Delegate {} succeeded in {} ms", name, result.durationMs());
        } else {
            LOG.warn("Delegate {} failed in {} ms [{}]: {}", name, result.durationMs(),
                    result.failureCode(), result.failureMessage());
        }
        return result;
    }

    private static DelegateResult fromCause(String name, Throwable cause, long durationMs) {
        if (cause instanceof DelegateFailureException dfe) {
            return DelegateResult.failure(name, dfe.getCode(), dfe.getMessage(), durationMs);
        }
        String message = cause == null ? "unknown error"
                : cause.getClass().getSimpleName() + (cause.getMessage() == null ? "" : ": " + cause.getMessage());
        return DelegateResult.failure(name, DelegateResult.CODE_ERROR, message, durationMs);
    }

    private static boolean hasLimit(Duration timeout) {
        return timeout != null && !timeout.isZero() && !timeout.isNegative();
    }
}
