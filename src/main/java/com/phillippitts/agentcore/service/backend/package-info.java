/**
 * Pluggable backends and the registries that own them.
 *
 * <h2>Lifecycle</h2>
 * <p>Each {@link com.phillippitts.agentcore.service.backend.BackendProvider BackendProvider} moves
 * through {@code UNREGISTERED -> INITIALIZING -> READY | FAILED}. A READY provider whose health
 * probe fails becomes {@code DEGRADED} and returns to READY on the next passing probe. Preparation
 * (model download, warm-up) runs at most once per provider on the {@code backendInitExecutor};
 * a FAILED provider gets a fresh attempt only through {@code reinitialize(id)}.</p>
 *
 * <h2>Selection</h2>
 * <p>The selected id is an atomic pointer. Callers read {@code current()} once per operation and
 * finish against that reference, so a concurrent {@code select(id)} never disturbs in-flight work.
 * Providers are closed only when the registry shuts down.</p>
 *
 * <h2>Events</h2>
 * <ul>
 *   <li>{@link com.phillippitts.agentcore.service.backend.event.BackendReadyEvent}</li>
 *   <li>{@link com.phillippitts.agentcore.service.backend.event.BackendFailedEvent}</li>
 *   <li>{@link com.phillippitts.agentcore.service.backend.event.BackendHealthChangedEvent}</li>
 *   <li>{@link com.phillippitts.agentcore.service.backend.event.BackendSelectedEvent}</li>
 * </ul>
 *
 * @see com.phillippitts.agentcore.service.backend.BackendRegistry
 * @see com.phillippitts.agentcore.service.health.BackendHealthIndicator
 */
package com.phillippitts.agentcore.service.backend;
