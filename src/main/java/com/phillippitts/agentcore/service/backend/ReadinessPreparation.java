package com.phillippitts.agentcore.service.backend;

/**
 * Optional capability of a provider that needs work before its first use
 * (model download, binary check, warm-up synthesis).
 *
 * <p>The registry runs {@link #prepare()} on its initialization executor at most once per
 * successful lifetime; it is retried only through an explicit reinitialize after a failure.
 */
public interface ReadinessPreparation {

    /**
     * Blocks until the provider is ready.
     *
     * @throws RuntimeException with a descriptive message when the provider cannot become ready
     */
    void prepare();
}
