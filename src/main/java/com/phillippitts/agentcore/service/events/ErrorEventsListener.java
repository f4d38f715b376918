package com.phillippitts.agentcore.service.events;

import com.phillippitts.agentcore.domain.ProgressEvent;
import com.phillippitts.agentcore.domain.ProgressEventType;
import com.phillippitts.agentcore.service.backend.event.BackendFailedEvent;
import com.phillippitts.agentcore.service.backend.event.BackendHealthChangedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for operator-facing error events. Privacy-safe and throttled to avoid log spam.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private final Clock clock;

    ErrorEventsListener(Clock clock) {
        this.clock = clock;
    }

    @EventListener
    void onBackendFailed(BackendFailedEvent e) {
        String key = "backend-" + e.family() + '-' + e.backendId();
        if (shouldLog(key)) {
            LOG.warn("{} backend {} failed: {}. Check binary and model paths under backend.*",
                    e.family(), e.backendId(), e.message());
        }
    }

    @EventListener
    void onHealthChanged(BackendHealthChangedEvent e) {
        String key = "health-" + e.family() + '-' + e.backendId() + '-' + e.to();
        if (shouldLog(key)) {
            LOG.warn("{} backend {} moved {} -> {}: {}", e.family(), e.backendId(), e.from(), e.to(), e.reason());
        }
    }

    // message carries the failure reason only; answers never reach this branch
    @EventListener
    void onRequestFailed(ProgressEvent e) {
        if (e.type() != ProgressEventType.FAILED) {
            return;
        }
        if (shouldLog("request-failed")) {
            LOG.warn("Request {} failed: {}", e.requestId(), e.message());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = clock.instant();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
