package com.phillippitts.agentcore.service.backend;

import com.phillippitts.agentcore.domain.HealthProbe;
import com.phillippitts.agentcore.exception.BackendOperationException;

/**
 * Template for providers with a prepare/close lifecycle.
 *
 * <p>{@link #prepare()} and {@link #close()} are idempotent and synchronized on an internal
 * lock; subclasses implement {@link #doPrepare()}, {@link #doClose()} and optionally
 * {@link #doHealthCheck()}. A provider that failed to prepare can be prepared again; a closed
 * provider cannot.
 *
 * <p>Lifecycle: created → prepared → closed.
 */
public abstract class AbstractBackendProvider implements BackendProvider, ReadinessPreparation {

    protected final Object lock = new Object();

    /** Guarded by {@link #lock}. */
    protected boolean prepared = false;

    /** Guarded by {@link #lock}. */
    protected boolean closed = false;

    @Override
    public final void prepare() {
        synchronized (lock) {
            if (closed) {
                throw new IllegalStateException(id() + " is closed");
            }
            if (prepared) {
                return;
            }
            doPrepare();
            prepared = true;
        }
    }

    /**
     * Provider-specific preparation, called under the lock.
     * Throw a descriptive runtime exception on failure.
     */
    protected abstract void doPrepare();

    @Override
    public final HealthProbe healthCheck() {
        synchronized (lock) {
            if (closed) {
                return HealthProbe.down(id() + " is closed", "Restart the application");
            }
            if (!prepared) {
                return HealthProbe.down(id() + " has not been prepared", "Wait for initialization to finish");
            }
        }
        return doHealthCheck();
    }

    /**
     * Provider-specific probe, called outside the lock once the provider is prepared.
     * Defaults to healthy.
     */
    protected HealthProbe doHealthCheck() {
        return HealthProbe.up();
    }

    @Override
    public final void close() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            doClose();
            closed = true;
            prepared = false;
        }
    }

    /** Provider-specific cleanup. Must not throw; log instead. */
    protected abstract void doClose();

    /**
     * Guards operation entry points.
     *
     * @throws BackendOperationException if the provider is not prepared or already closed
     */
    protected final void ensurePrepared() {
        synchronized (lock) {
            if (!prepared || closed) {
                throw new BackendOperationException(displayName() + " not prepared or closed", id());
            }
        }
    }

    /**
     * Wraps an operation failure with this provider's id, keeping existing
     * {@link BackendOperationException}s as they are.
     */
    protected final BackendOperationException operationFailure(String operation, Exception e) {
        if (e instanceof BackendOperationException boe) {
            return boe;
        }
        return new BackendOperationException(operation + " failed: " + e.getMessage(), id(), e);
    }
}
