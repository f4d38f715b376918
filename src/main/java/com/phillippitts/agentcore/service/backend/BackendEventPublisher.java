package com.phillippitts.agentcore.service.backend;

import com.phillippitts.agentcore.service.backend.event.BackendFailedEvent;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.Map;

/**
 * Null-safe helpers for publishing backend events.
 * A {@code null} publisher is allowed so registries and providers run without Spring in tests.
 */
public final class BackendEventPublisher {

    private BackendEventPublisher() {
    }

    public static void publish(ApplicationEventPublisher publisher, Object event) {
        if (publisher != null) {
            publisher.publishEvent(event);
        }
    }

    public static void publishFailure(ApplicationEventPublisher publisher,
                                      String family,
                                      String backendId,
                                      String message,
                                      Throwable cause,
                                      Map<String, String> context) {
        publish(publisher, new BackendFailedEvent(family, backendId, message, cause, context, Instant.now()));
    }

    public static void publishFailure(ApplicationEventPublisher publisher,
                                      String family,
                                      String backendId,
                                      String message,
                                      Throwable cause) {
        publishFailure(publisher, family, backendId, message, cause, null);
    }
}
