package com.phillippitts.agentcore.service.queue;

import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single slot holding the id of the running request. Written only by the queue worker.
 */
final class RunningSlot {

    private final Lock lock = new ReentrantLock();
    private String running;

    /**
     * @return false if another request already occupies the slot
     */
    boolean occupy(String requestId) {
        if (requestId == null) {
            throw new NullPointerException("requestId cannot be null");
        }
        lock.lock();
        try {
            if (running != null) {
                return false;
            }
            running = requestId;
            return true;
        } finally {
            lock.unlock();
        }
    }

    boolean release(String expected) {
        lock.lock();
        try {
            if (running == null || !running.equals(expected)) {
                return false;
            }
            running = null;
            return true;
        } finally {
            lock.unlock();
        }
    }

    Optional<String> current() {
        lock.lock();
        try {
            return Optional.ofNullable(running);
        } finally {
            lock.unlock();
        }
    }
}
