package com.phillippitts.agentcore.service.metrics;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/**
 * Null-safe facade over {@link OrchestrationMetrics}.
 *
 * <p>Components take a publisher instead of the metrics bean so they can run in unit tests
 * with {@link #NOOP}. Metric failures never propagate into orchestration code.
 */
@Component
public final class OrchestrationMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(OrchestrationMetricsPublisher.class);

    /** Publisher that records nothing. */
    public static final OrchestrationMetricsPublisher NOOP = new OrchestrationMetricsPublisher(null);

    private final OrchestrationMetrics metrics;

    public OrchestrationMetricsPublisher(OrchestrationMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("OrchestrationMetricsPublisher created without metrics (test mode)");
        }
    }

    public void recordRequest(String status, long durationNanos) {
        if (metrics != null) {
            metrics.recordRequest(status, durationNanos);
        }
    }

    public void recordDelegateCall(String delegate, String outcome, long durationMs) {
        if (metrics != null) {
            metrics.recordDelegateCall(delegate, outcome, durationMs);
        }
    }

    public void recordBackendInit(String family, String backendId, String outcome, long durationNanos) {
        if (metrics != null) {
            metrics.recordBackendInit(family, backendId, outcome, durationNanos);
        }
    }

    public void recordStage(String stage, String outcome, long durationNanos) {
        if (metrics != null) {
            metrics.recordStage(stage, outcome, durationNanos);
        }
    }

    public boolean isEnabled() {
        return metrics != null;
    }
}
