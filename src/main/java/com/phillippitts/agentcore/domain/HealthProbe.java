package com.phillippitts.agentcore.domain;

/**
 * Outcome of a provider health check.
 *
 * @param ready whether the provider can serve calls right now
 * @param reason why it is not ready; {@code null} when ready
 * @param remediation operator hint for fixing the problem; may be {@code null}
 */
public record HealthProbe(boolean ready, String reason, String remediation) {

    private static final HealthProbe UP = new HealthProbe(true, null, null);

    public static HealthProbe up() {
        return UP;
    }

    public static HealthProbe down(String reason, String remediation) {
        return new HealthProbe(false, reason == null || reason.isBlank() ? "not ready" : reason, remediation);
    }
}
