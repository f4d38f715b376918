package com.phillippitts.agentcore.service.queue;

/**
 * Handle returned by subscribe calls; closing it stops delivery. Idempotent.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    @Override
    void close();
}
