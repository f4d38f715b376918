package com.phillippitts.agentcore.service.backend;

import com.phillippitts.agentcore.domain.HealthProbe;

/**
 * A pluggable implementation of one capability family (transcription or synthesis).
 *
 * <p>Providers are owned by their {@link BackendRegistry}: the registry prepares them,
 * probes them and closes them at shutdown. Selecting another provider never closes the
 * previous one, so a caller holding a reference can always finish its call.
 */
public interface BackendProvider extends AutoCloseable {

    /** Stable id, unique within the family (e.g. {@code whisper-cpp}). */
    String id();

    /** Human-readable name for UIs and logs. */
    String displayName();

    /**
     * Cheap readiness probe. Must not block on long I/O; the registry caches the result.
     */
    HealthProbe healthCheck();

    /** Releases resources. Idempotent; never throws. */
    @Override
    void close();
}
