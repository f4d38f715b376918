package com.phillippitts.agentcore.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Budget of each top-level reasoning loop run. Zero durations disable the corresponding limit.
 */
@ConfigurationProperties(prefix = "agent.loop")
@Validated
public class AgentLoopProperties {

    @Min(value = 1, message = "max-iterations must be at least 1")
    private int maxIterations = 8;

    @PositiveOrZero
    private long delegateTimeoutMs = 30_000;

    @PositiveOrZero
    private long wallClockBudgetMs = 300_000;

    /** Disabled by default: the reasoning call is then bounded only by the HTTP client timeout. */
    @PositiveOrZero
    private long reasoningTimeoutMs = 0;

    public int getMaxIterations() {
        return maxIterations;
    }

    public void setMaxIterations(int maxIterations) {
        this.maxIterations = maxIterations;
    }

    public long getDelegateTimeoutMs() {
        return delegateTimeoutMs;
    }

    public void setDelegateTimeoutMs(long delegateTimeoutMs) {
        this.delegateTimeoutMs = delegateTimeoutMs;
    }

    public long getWallClockBudgetMs() {
        return wallClockBudgetMs;
    }

    public void setWallClockBudgetMs(long wallClockBudgetMs) {
        this.wallClockBudgetMs = wallClockBudgetMs;
    }

    public long getReasoningTimeoutMs() {
        return reasoningTimeoutMs;
    }

    public void setReasoningTimeoutMs(long reasoningTimeoutMs) {
        this.reasoningTimeoutMs = reasoningTimeoutMs;
    }
}
