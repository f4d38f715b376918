package com.phillippitts.agentcore.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for orchestration and backend lifecycle.
 *
 * <p>Meters (all under {@code agentcore.}):
 * <ul>
 *   <li>{@code request.latency} timer, tagged by terminal status</li>
 *   <li>{@code delegate.calls} counter and {@code delegate.latency} timer, tagged by delegate and outcome</li>
 *   <li>{@code backend.init} counter and timer, tagged by family, backend and outcome</li>
 *   <li>{@code pipeline.stage} timer, tagged by stage and outcome</li>
 * </ul>
 *
 * <p>Exposed at /actuator/prometheus.
 */
@Component
public class OrchestrationMetrics {

    private static final String PREFIX = "agentcore";

    private final MeterRegistry registry;

    public OrchestrationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordRequest(String status, long durationNanos) {
        Timer.builder(PREFIX + ".request.latency")
                .description("Time from request start to terminal status")
                .tag("status", status)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void recordDelegateCall(String delegate, String outcome, long durationMs) {
        Counter.builder(PREFIX + ".delegate.calls")
                .description("Delegate invocations")
                .tag("delegate", delegate)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
        Timer.builder(PREFIX + ".delegate.latency")
                .description("Delegate invocation latency")
                .tag("delegate", delegate)
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    public void recordBackendInit(String family, String backendId, String outcome, long durationNanos) {
        Counter.builder(PREFIX + ".backend.init")
                .description("Backend readiness preparations by outcome")
                .tag("family", family)
                .tag("backend", backendId)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
        Timer.builder(PREFIX + ".backend.init.latency")
                .description("Backend readiness preparation latency")
                .tag("family", family)
                .tag("backend", backendId)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void recordStage(String stage, String outcome, long durationNanos) {
        Timer.builder(PREFIX + ".pipeline.stage")
                .description("Speech pipeline stage latency")
                .tag("stage", stage)
                .tag("outcome", outcome)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }
}
