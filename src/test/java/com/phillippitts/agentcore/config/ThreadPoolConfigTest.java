package com.phillippitts.agentcore.config;

import com.phillippitts.agentcore.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ThreadPoolConfigTest {

    private final ThreadPoolConfig config = new ThreadPoolConfig(new ThreadPoolProperties());
    private ThreadPoolTaskExecutor executor;

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
        if (executor != null) {
            executor.shutdown();
        }
    }

    @Test
    void orchestrationExecutorHasExactlyOneThread() {
        executor = config.orchestrationExecutor();

        assertThat(executor.getCorePoolSize()).isEqualTo(1);
        assertThat(executor.getMaxPoolSize()).isEqualTo(1);
        assertThat(executor.getThreadNamePrefix()).isEqualTo("orchestration-");
    }

    @Test
    void delegateExecutorUsesConfiguredDefaults() {
        executor = config.delegateExecutor();

        assertThat(executor.getCorePoolSize()).isEqualTo(4);
        assertThat(executor.getMaxPoolSize()).isEqualTo(8);
        assertThat(executor.getThreadNamePrefix()).isEqualTo("delegate-");
    }

    @Test
    void requestIdFollowsTaskToWorkerThread() throws Exception {
        executor = config.backendInitExecutor();
        ThreadContext.put("requestId", "req-7");
        CompletableFuture<String> seen = new CompletableFuture<>();

        executor.execute(() -> seen.complete(ThreadContext.get("requestId")));

        assertThat(seen.get(5, TimeUnit.SECONDS)).isEqualTo("req-7");
    }
}
