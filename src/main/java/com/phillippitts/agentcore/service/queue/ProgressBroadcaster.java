package com.phillippitts.agentcore.service.queue;

import com.phillippitts.agentcore.domain.ProgressEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * Fans progress events out to global subscribers, per-request subscribers and the Spring event
 * bus, in that order. A failing subscriber is logged and skipped.
 */
final class ProgressBroadcaster {

    private static final Logger LOG = LogManager.getLogger(ProgressBroadcaster.class);

    private final ApplicationEventPublisher publisher;
    private final List<ProgressSubscriber> global = new CopyOnWriteArrayList<>();
    private final Map<String, List<ProgressSubscriber>> perRequest = new ConcurrentHashMap<>();

    ProgressBroadcaster(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
    }

    void publish(ProgressEvent event) {
        for (ProgressSubscriber s : global) {
            deliver(s, event);
        }
        List<ProgressSubscriber> subs = perRequest.get(event.requestId());
        if (subs != null) {
            for (ProgressSubscriber s : subs) {
                deliver(s, event);
            }
        }
        if (publisher != null) {
            try {
                publisher.publishEvent(event);
            } catch (RuntimeException e) {
                LOG.warn("Progress event listener failed for request {}: {}", event.requestId(), e.toString());
            }
        }
    }

    /**
     * Registers a per-request subscriber that first receives {@code history} and then live events.
     * Registration and replay happen under the subscriber's lock, and live events already covered
     * by the replay are dropped, so the subscriber sees strictly increasing sequence numbers.
     *
     * @param history read after registration; must return every event emitted so far
     */
    Subscription addReplaying(String requestId, ProgressSubscriber subscriber,
                              Supplier<List<ProgressEvent>> history) {
        ReplayingSubscriber replaying = new ReplayingSubscriber(subscriber);
        Subscription subscription;
        synchronized (replaying) {
            subscription = add(requestId, replaying);
            for (ProgressEvent event : history.get()) {
                replaying.forward(event);
            }
        }
        return subscription;
    }

    Subscription addGlobal(ProgressSubscriber subscriber) {
        global.add(subscriber);
        return () -> global.remove(subscriber);
    }

    private Subscription add(String requestId, ProgressSubscriber subscriber) {
        perRequest.computeIfAbsent(requestId, id -> new CopyOnWriteArrayList<>()).add(subscriber);
        return () -> {
            List<ProgressSubscriber> subs = perRequest.get(requestId);
            if (subs != null) {
                subs.remove(subscriber);
            }
        };
    }

    void forget(String requestId) {
        perRequest.remove(requestId);
    }

    private static final class ReplayingSubscriber implements ProgressSubscriber {
        private final ProgressSubscriber delegate;
        private long lastSequence;

        ReplayingSubscriber(ProgressSubscriber delegate) {
            this.delegate = delegate;
        }

        @Override
        public synchronized void onEvent(ProgressEvent event) {
            forward(event);
        }

        // caller holds this monitor
        private void forward(ProgressEvent event) {
            if (event.sequence() <= lastSequence) {
                return;
            }
            lastSequence = event.sequence();
            deliver(delegate, event);
        }
    }

    private static void deliver(ProgressSubscriber subscriber, ProgressEvent event) {
        try {
            subscriber.onEvent(event);
        } catch (RuntimeException e) {
            LOG.warn("Progress subscriber failed on {} #{} of request {}: {}",
                    event.type(), event.sequence(), event.requestId(), e.toString());
        }
    }
}
