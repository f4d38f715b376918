package com.phillippitts.agentcore.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Sizing of the delegate and backend-initialization pools. The orchestration worker always
 * runs on a dedicated single thread.
 */
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private PoolProperties delegate = new PoolProperties(4, 8, 50, "delegate-");
    private PoolProperties backendInit = new PoolProperties(2, 4, 20, "backend-init-");

    public PoolProperties getDelegate() {
        return delegate;
    }

    public void setDelegate(PoolProperties delegate) {
        this.delegate = delegate;
    }

    public PoolProperties getBackendInit() {
        return backendInit;
    }

    public void setBackendInit(PoolProperties backendInit) {
        this.backendInit = backendInit;
    }

    public static class PoolProperties {
        private int corePoolSize;
        private int maxPoolSize;
        private int queueCapacity;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix;

        public PoolProperties() {
        }

        PoolProperties(int corePoolSize, int maxPoolSize, int queueCapacity, String threadNamePrefix) {
            this.corePoolSize = corePoolSize;
            this.maxPoolSize = maxPoolSize;
            this.queueCapacity = queueCapacity;
            this.threadNamePrefix = threadNamePrefix;
        }

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
