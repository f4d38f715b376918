package com.phillippitts.agentcore.config;

import com.phillippitts.agentcore.service.queue.OrchestrationQueue;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executor and queue gauges, exposed under {@code agentcore.pool.*} and {@code agentcore.queue.*}.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> delegateExecutorProvider;
    private final ObjectProvider<ThreadPoolTaskExecutor> backendInitExecutorProvider;
    private final ObjectProvider<OrchestrationQueue> queueProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("delegateExecutor") ObjectProvider<ThreadPoolTaskExecutor> delegateExecutorProvider,
            @Qualifier("backendInitExecutor") ObjectProvider<ThreadPoolTaskExecutor> backendInitExecutorProvider,
            ObjectProvider<OrchestrationQueue> queueProvider) {
        this.delegateExecutorProvider = delegateExecutorProvider;
        this.backendInitExecutorProvider = backendInitExecutorProvider;
        this.queueProvider = queueProvider;
    }

    @Bean
    public MeterBinder orchestrationPoolMetrics() {
        return registry -> {
            bindPool(registry, "delegate", delegateExecutorProvider.getObject().getThreadPoolExecutor());
            bindPool(registry, "backend-init", backendInitExecutorProvider.getObject().getThreadPoolExecutor());
            OrchestrationQueue queue = queueProvider.getIfAvailable();
            if (queue != null) {
                Gauge.builder("agentcore.queue.depth", queue, OrchestrationQueue::depth)
                        .description("Requests waiting to run")
                        .register(registry);
                Gauge.builder("agentcore.queue.running", queue, q -> q.runningRequestId().isPresent() ? 1 : 0)
                        .description("1 while a request is running")
                        .register(registry);
            }
            LOG.info("Pool metrics registered: agentcore.pool.* and agentcore.queue.* via /actuator/metrics");
        };
    }

    private static void bindPool(MeterRegistry registry, String pool, ThreadPoolExecutor executor) {
        Gauge.builder("agentcore.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                .tag("pool", pool)
                .description("Current number of threads")
                .register(registry);
        Gauge.builder("agentcore.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                .tag("pool", pool)
                .description("Threads actively executing tasks")
                .register(registry);
        Gauge.builder("agentcore.pool.queued", executor, e -> e.getQueue().size())
                .tag("pool", pool)
                .description("Tasks waiting for a thread")
                .register(registry);
        Gauge.builder("agentcore.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                .tag("pool", pool)
                .description("Cumulative count of completed tasks")
                .register(registry);
    }

    @Scheduled(fixedRate = 300_000)
    public void logThreadPoolHealth() {
        ThreadPoolExecutor executor = delegateExecutorProvider.getObject().getThreadPoolExecutor();
        LOG.info("Delegate pool health: size={}/{}, active={}, queued={}, completed={}",
                executor.getPoolSize(),
                executor.getMaximumPoolSize(),
                executor.getActiveCount(),
                executor.getQueue().size(),
                executor.getCompletedTaskCount());
    }
}
