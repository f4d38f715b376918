package com.phillippitts.agentcore.config;

import com.phillippitts.agentcore.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executors of the orchestration core. All of them copy the submitting thread's Log4j2
 * {@link ThreadContext} (request id) to the worker thread.
 *
 * <ul>
 *   <li>{@code orchestrationExecutor}: exactly one thread, hosting the queue worker</li>
 *   <li>{@code delegateExecutor}: delegate calls, reasoning calls with a timeout, pipeline stages</li>
 *   <li>{@code backendInitExecutor}: provider readiness preparation</li>
 * </ul>
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    @Bean(name = "orchestrationExecutor")
    public ThreadPoolTaskExecutor orchestrationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(1);
        executor.setThreadNamePrefix("orchestration-");
        executor.setTaskDecorator(threadContextDecorator());
        // the worker loop only exits once the queue is stopped
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(5);
        executor.initialize();
        return executor;
    }

    @Bean(name = "delegateExecutor")
    public ThreadPoolTaskExecutor delegateExecutor() {
        return pool(threadPoolProperties.getDelegate(), new ThreadPoolExecutor.AbortPolicy());
    }

    @Bean(name = "backendInitExecutor")
    public ThreadPoolTaskExecutor backendInitExecutor() {
        return pool(threadPoolProperties.getBackendInit(), new ThreadPoolExecutor.CallerRunsPolicy());
    }

    private static ThreadPoolTaskExecutor pool(ThreadPoolProperties.PoolProperties props,
                                               RejectedExecutionHandler rejection) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(rejection);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(threadContextDecorator());
        executor.initialize();
        return executor;
    }

    static TaskDecorator threadContextDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
