package com.phillippitts.agentcore.service.agent;

import com.phillippitts.agentcore.config.properties.AgentLoopProperties;

import java.time.Duration;

/**
 * Limits for one reasoning loop run. Zero durations mean "no limit".
 *
 * @param maxIterations maximum number of turns
 * @param delegateTimeout limit per delegate call
 * @param wallClock limit for the whole run, checked at turn boundaries
 * @param reasoningTimeout limit per reasoning backend call
 */
public record LoopBudget(int maxIterations, Duration delegateTimeout, Duration wallClock, Duration reasoningTimeout) {

    public LoopBudget {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be >= 1, got " + maxIterations);
        }
        delegateTimeout = delegateTimeout == null ? Duration.ZERO : delegateTimeout;
        wallClock = wallClock == null ? Duration.ZERO : wallClock;
        reasoningTimeout = reasoningTimeout == null ? Duration.ZERO : reasoningTimeout;
    }

    public static LoopBudget of(int maxIterations) {
        return new LoopBudget(maxIterations, Duration.ofSeconds(30), Duration.ZERO, Duration.ZERO);
    }

    public static LoopBudget from(AgentLoopProperties props) {
        return new LoopBudget(props.getMaxIterations(),
                Duration.ofMillis(props.getDelegateTimeoutMs()),
                Duration.ofMillis(props.getWallClockBudgetMs()),
                Duration.ofMillis(props.getReasoningTimeoutMs()));
    }
}
