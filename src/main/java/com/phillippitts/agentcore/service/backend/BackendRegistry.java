package com.phillippitts.agentcore.service.backend;

import com.phillippitts.agentcore.domain.BackendFamily;
import com.phillippitts.agentcore.domain.BackendReadiness;
import com.phillippitts.agentcore.domain.BackendStatus;
import com.phillippitts.agentcore.domain.HealthProbe;
import com.phillippitts.agentcore.exception.BackendNotReadyException;
import com.phillippitts.agentcore.exception.DuplicateBackendException;
import com.phillippitts.agentcore.exception.UnknownBackendException;
import com.phillippitts.agentcore.service.backend.event.BackendHealthChangedEvent;
import com.phillippitts.agentcore.service.backend.event.BackendReadyEvent;
import com.phillippitts.agentcore.service.backend.event.BackendSelectedEvent;
import com.phillippitts.agentcore.service.metrics.OrchestrationMetricsPublisher;
import com.phillippitts.agentcore.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Registry of interchangeable providers for one capability family.
 *
 * <p>The registry owns every registered provider for the life of the process. It prepares them
 * concurrently on the initialization executor, keeps a cached health probe per provider, and
 * holds the selected id in an {@link AtomicReference}. Selection only moves the pointer: callers
 * take {@link #current()} once per operation and finish against that reference, and providers are
 * closed only by {@link #close()} at shutdown.
 *
 * <p><b>Selection policy:</b> once initialization has started there is always a selected id.
 * After {@link #initializeAll()} completes, a selection that is not usable is replaced by the
 * preferred provider if READY, else by the first READY provider in registration order; if none is
 * READY the selection stays on the preferred provider and its failure reason is reported by
 * {@link #health()}.
 *
 * <p><b>Thread Safety:</b> all public methods are thread-safe. Preparation of one provider never
 * blocks another; {@link #current()} never blocks.
 *
 * @param <P> provider type of the family
 */
public class BackendRegistry<P extends BackendProvider> implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(BackendRegistry.class);

    /**
     * Registry tuning.
     *
     * @param preferredId provider to select by default; {@code null} for the first registered
     * @param selectTimeout how long {@link #select} waits for an INITIALIZING provider
     * @param healthCacheTtl how long a health probe result is reused
     */
    public record Settings(String preferredId, Duration selectTimeout, Duration healthCacheTtl) {
        public Settings {
            preferredId = preferredId == null || preferredId.isBlank() ? null : preferredId.trim();
            if (selectTimeout == null || selectTimeout.isNegative()) {
                selectTimeout = Duration.ofSeconds(30);
            }
            if (healthCacheTtl == null || healthCacheTtl.isNegative()) {
                healthCacheTtl = Duration.ofSeconds(5);
            }
        }

        public static Settings defaults() {
            return new Settings(null, null, null);
        }
    }

    /**
     * The selected provider together with its readiness at lookup time.
     */
    public record Selection<P>(String id, P provider, BackendReadiness readiness) {
        public boolean isUsable() {
            return readiness.isUsable();
        }

        public boolean isDegraded() {
            return readiness == BackendReadiness.DEGRADED;
        }
    }

    private static final class Entry<P extends BackendProvider> {
        final P provider;
        final ReentrantLock lock = new ReentrantLock();
        volatile BackendReadiness readiness = BackendReadiness.UNREGISTERED;
        volatile String failureReason;
        volatile HealthProbe lastProbe;
        volatile Instant probedAt;
        // guarded by lock
        CompletableFuture<BackendReadiness> preparation;

        Entry(P provider) {
            this.provider = provider;
        }
    }

    private final BackendFamily family;
    private final Settings settings;
    private final Executor initExecutor;
    private final ApplicationEventPublisher publisher;
    private final OrchestrationMetricsPublisher metrics;
    private final Clock clock;

    private final Map<String, Entry<P>> entries = new ConcurrentHashMap<>();
    private final List<String> registrationOrder = new CopyOnWriteArrayList<>();
    private final AtomicReference<String> selected = new AtomicReference<>();
    private final Object registrationLock = new Object();
    private volatile boolean closed;

    public BackendRegistry(BackendFamily family,
                           Settings settings,
                           Executor initExecutor,
                           ApplicationEventPublisher publisher,
                           OrchestrationMetricsPublisher metrics,
                           Clock clock) {
        this.family = Objects.requireNonNull(family, "family");
        this.settings = settings != null ? settings : Settings.defaults();
        this.initExecutor = Objects.requireNonNull(initExecutor, "initExecutor");
        this.publisher = publisher;
        this.metrics = metrics != null ? metrics : OrchestrationMetricsPublisher.NOOP;
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    public BackendFamily family() {
        return family;
    }

    /**
     * Adds a provider. Registration does not start preparation.
     *
     * @throws DuplicateBackendException if the id is already registered (the first one stays)
     * @throws IllegalStateException if the registry is closed
     */
    public void register(P provider) {
        Objects.requireNonNull(provider, "provider");
        String id = Objects.requireNonNull(provider.id(), "provider id");
        synchronized (registrationLock) {
            if (closed) {
                throw new IllegalStateException(family.key() + " registry is closed");
            }
            if (entries.containsKey(id)) {
                throw new DuplicateBackendException(family.key(), id);
            }
            entries.put(id, new Entry<>(provider));
            registrationOrder.add(id);
        }
        LOG.info("Registered {} backend id={} ({})", family.key(), id, provider.displayName());
    }

    /**
     * Starts readiness preparation of every registered provider in parallel.
     *
     * <p>Each provider ends READY (or DEGRADED when its first probe fails) or FAILED with a reason;
     * one failure never affects the others. Calling this again reuses the preparations already
     * started, so no provider is prepared twice.
     *
     * @return future completing once every provider has settled and the selection policy ran
     */
    public CompletableFuture<Void> initializeAll() {
        List<String> ids = List.copyOf(registrationOrder);
        if (ids.isEmpty()) {
            LOG.warn("No {} backends registered; nothing to initialize", family.key());
            return CompletableFuture.completedFuture(null);
        }
        if (selected.compareAndSet(null, preferredOrFirst())) {
            publishSelection(null, selected.get());
        }
        CompletableFuture<?>[] preparations = ids.stream()
                .map(entries::get)
                .map(this::startPreparation)
                .toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(preparations).thenRun(this::applySelectionPolicy);
    }

    /**
     * Retries preparation of a FAILED provider. For any other state the existing preparation is
     * returned unchanged.
     *
     * @throws UnknownBackendException if the id is not registered
     */
    public CompletableFuture<BackendReadiness> reinitialize(String id) {
        Entry<P> entry = require(id);
        entry.lock.lock();
        try {
            if (entry.readiness != BackendReadiness.FAILED) {
                return startPreparation(entry);
            }
            LOG.info("Re-initializing failed {} backend {}", family.key(), id);
            entry.preparation = null;
        } finally {
            entry.lock.unlock();
        }
        return startPreparation(entry).thenApply(readiness -> {
            if (readiness.isUsable()) {
                applySelectionPolicy();
            }
            return readiness;
        });
    }

    /**
     * Makes {@code id} the selected provider.
     *
     * <p>An INITIALIZING provider is awaited for at most {@link Settings#selectTimeout()}; a provider
     * whose preparation never started is started now. On any failure the selection is unchanged.
     *
     * @return the newly selected provider
     * @throws UnknownBackendException if the id is not registered
     * @throws BackendNotReadyException if the provider is FAILED, not READY, or still initializing
     */
    public P select(String id) {
        Entry<P> entry = entries.get(id);
        if (entry == null) {
            throw new UnknownBackendException(family.key(), id);
        }
        awaitPreparation(entry, id);
        BackendReadiness readiness = entry.readiness;
        if (readiness != BackendReadiness.READY) {
            String reason = readiness == BackendReadiness.FAILED && entry.failureReason != null
                    ? entry.failureReason
                    : "provider is " + readiness;
            throw new BackendNotReadyException(family.key(), id, reason);
        }
        String previous = selected.getAndSet(id);
        if (!id.equals(previous)) {
            publishSelection(previous, id);
        }
        return entry.provider;
    }

    /**
     * Returns the selected provider without blocking.
     *
     * @throws BackendNotReadyException only when no provider is registered
     */
    public P current() {
        return currentSelection().provider();
    }

    /**
     * Returns the selected provider with its readiness, without blocking.
     *
     * @throws BackendNotReadyException only when no provider is registered
     */
    public Selection<P> currentSelection() {
        String id = selected.get();
        if (id == null) {
            if (registrationOrder.isEmpty()) {
                throw new BackendNotReadyException(family.key(), "<none>", "no providers registered");
            }
            if (selected.compareAndSet(null, preferredOrFirst())) {
                publishSelection(null, selected.get());
            }
            id = selected.get();
        }
        Entry<P> entry = entries.get(id);
        return new Selection<>(id, entry.provider, entry.readiness);
    }

    public Optional<String> selectedId() {
        return Optional.ofNullable(selected.get());
    }

    /**
     * Snapshot of every provider in registration order. Stale probe results (older than the
     * cache TTL) of READY and DEGRADED providers are refreshed first.
     */
    public List<BackendStatus> health() {
        String current = selected.get();
        List<BackendStatus> statuses = new ArrayList<>(registrationOrder.size());
        for (String id : registrationOrder) {
            Entry<P> entry = entries.get(id);
            refreshProbeIfStale(entry);
            statuses.add(toStatus(id, entry, id.equals(current)));
        }
        return statuses;
    }

    /**
     * Status of one provider, probing it if its cached probe is stale.
     *
     * @throws UnknownBackendException if the id is not registered
     */
    public BackendStatus status(String id) {
        Entry<P> entry = require(id);
        refreshProbeIfStale(entry);
        return toStatus(id, entry, id.equals(selected.get()));
    }

    public Optional<String> failureReason(String id) {
        return Optional.ofNullable(require(id).failureReason);
    }

    public List<String> ids() {
        return List.copyOf(registrationOrder);
    }

    /**
     * Closes every provider. Called once at shutdown; the registry rejects new registrations
     * afterwards.
     */
    @Override
    public void close() {
        synchronized (registrationLock) {
            if (closed) {
                return;
            }
            closed = true;
        }
        for (String id : registrationOrder) {
            try {
                entries.get(id).provider.close();
            } catch (RuntimeException e) {
                LOG.warn("Error closing {} backend {}: {}", family.key(), id, e.toString());
            }
        }
        LOG.info("Closed {} registry ({} providers)", family.key(), registrationOrder.size());
    }

    private Entry<P> require(String id) {
        Entry<P> entry = id == null ? null : entries.get(id);
        if (entry == null) {
            throw new UnknownBackendException(family.key(), id);
        }
        return entry;
    }

    private CompletableFuture<BackendReadiness> startPreparation(Entry<P> entry) {
        entry.lock.lock();
        try {
            if (entry.preparation != null) {
                return entry.preparation;
            }
            entry.readiness = BackendReadiness.INITIALIZING;
            entry.failureReason = null;
            CompletableFuture<BackendReadiness> preparation;
            try {
                preparation = CompletableFuture.supplyAsync(() -> prepare(entry), initExecutor);
            } catch (RejectedExecutionException e) {
                preparation = CompletableFuture.completedFuture(
                        markFailed(entry, "initialization rejected: " + e.getMessage(), e, 0L));
            }
            entry.preparation = preparation;
            return preparation;
        } finally {
            entry.lock.unlock();
        }
    }

    private BackendReadiness prepare(Entry<P> entry) {
        String id = entry.provider.id();
        long start = System.nanoTime();
        LOG.info("Preparing {} backend {}", family.key(), id);
        try {
            if (entry.provider instanceof ReadinessPreparation preparation) {
                preparation.prepare();
            }
            HealthProbe probe = safeProbe(entry.provider);
            entry.lastProbe = probe;
            entry.probedAt = clock.instant();
            entry.readiness = probe.ready() ? BackendReadiness.READY : BackendReadiness.DEGRADED;

            long elapsed = System.nanoTime() - start;
            metrics.recordBackendInit(family.key(), id, "ready", elapsed);
            BackendEventPublisher.publish(publisher,
                    new BackendReadyEvent(family.key(), id, TimeUtils.nanosToMillis(elapsed), null));
            LOG.info("{} backend {} is {} after {} ms", family.key(), id, entry.readiness,
                    TimeUtils.nanosToMillis(elapsed));
            return entry.readiness;
        } catch (RuntimeException e) {
            return markFailed(entry, describe(e), e, System.nanoTime() - start);
        }
    }

    private BackendReadiness markFailed(Entry<P> entry, String reason, Throwable cause, long elapsedNanos) {
        String id = entry.provider.id();
        entry.failureReason = reason;
        entry.readiness = BackendReadiness.FAILED;
        metrics.recordBackendInit(family.key(), id, "failed", elapsedNanos);
        BackendEventPublisher.publishFailure(publisher, family.key(), id, "initialization failed: " + reason, cause);
        LOG.error("{} backend {} failed to initialize: {}", family.key(), id, reason);
        return BackendReadiness.FAILED;
    }

    private void awaitPreparation(Entry<P> entry, String id) {
        CompletableFuture<BackendReadiness> preparation = startPreparation(entry);
        long timeoutMs = settings.selectTimeout().toMillis();
        try {
            preparation.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new BackendNotReadyException(family.key(), id, "still initializing after " + timeoutMs + " ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendNotReadyException(family.key(), id, "interrupted while waiting for readiness", e);
        } catch (ExecutionException e) {
            throw new BackendNotReadyException(family.key(), id, describe(e.getCause()), e.getCause());
        }
    }

    private void applySelectionPolicy() {
        String current = selected.get();
        if (current != null && entries.get(current).readiness.isUsable()) {
            return;
        }
        String preferred = preferredOrFirst();
        String target;
        if (entries.get(preferred).readiness == BackendReadiness.READY) {
            target = preferred;
        } else {
            target = registrationOrder.stream()
                    .filter(id -> entries.get(id).readiness == BackendReadiness.READY)
                    .findFirst()
                    .orElse(preferred);
        }
        if (entries.get(target).readiness != BackendReadiness.READY) {
            LOG.warn("No READY {} backend; selection stays on {} ({})", family.key(), target,
                    entries.get(target).failureReason);
        }
        if (target.equals(current)) {
            return;
        }
        // a select() that landed since the read above wins
        if (!selected.compareAndSet(current, target)) {
            LOG.debug("{} selection changed concurrently; keeping {}", family.key(), selected.get());
            return;
        }
        publishSelection(current, target);
    }

    private String preferredOrFirst() {
        String preferred = settings.preferredId();
        if (preferred != null && entries.containsKey(preferred)) {
            return preferred;
        }
        if (preferred != null) {
            LOG.warn("Preferred {} backend '{}' is not registered; using first registered", family.key(), preferred);
        }
        return registrationOrder.get(0);
    }

    private void publishSelection(String previous, String id) {
        LOG.info("Selected {} backend: {} (was {})", family.key(), id, previous);
        BackendEventPublisher.publish(publisher, new BackendSelectedEvent(family.key(), previous, id, null));
    }

    private void refreshProbeIfStale(Entry<P> entry) {
        if (!entry.readiness.isUsable()) {
            return;
        }
        Instant now = clock.instant();
        Instant probedAt = entry.probedAt;
        if (probedAt != null && Duration.between(probedAt, now).compareTo(settings.healthCacheTtl()) < 0) {
            return;
        }
        if (!entry.lock.tryLock()) {
            return;
        }
        try {
            BackendReadiness from = entry.readiness;
            if (!from.isUsable()) {
                return;
            }
            HealthProbe probe = safeProbe(entry.provider);
            entry.lastProbe = probe;
            entry.probedAt = now;
            BackendReadiness to = probe.ready() ? BackendReadiness.READY : BackendReadiness.DEGRADED;
            if (from != to) {
                entry.readiness = to;
                LOG.warn("{} backend {} moved {} -> {} ({})", family.key(), entry.provider.id(), from, to,
                        probe.ready() ? "probe passed" : probe.reason());
                BackendEventPublisher.publish(publisher, new BackendHealthChangedEvent(
                        family.key(), entry.provider.id(), from, to, probe.reason(), now));
            }
        } finally {
            entry.lock.unlock();
        }
    }

    private static HealthProbe safeProbe(BackendProvider provider) {
        try {
            HealthProbe probe = provider.healthCheck();
            return probe != null ? probe : HealthProbe.down("health check returned no result", null);
        } catch (RuntimeException e) {
            return HealthProbe.down("health check failed: " + describe(e), null);
        }
    }

    private BackendStatus toStatus(String id, Entry<P> entry, boolean isSelected) {
        return new BackendStatus(id, entry.provider.displayName(), entry.readiness, isSelected,
                entry.lastProbe, entry.probedAt, entry.failureReason);
    }

    private static String describe(Throwable t) {
        if (t == null) {
            return "unknown error";
        }
        String message = t.getMessage();
        return message == null || message.isBlank() ? t.getClass().getSimpleName() : message;
    }
}
