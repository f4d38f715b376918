package com.phillippitts.agentcore.service.backend;

import com.phillippitts.agentcore.domain.BackendReadiness;
import com.phillippitts.agentcore.domain.BackendStatus;
import com.phillippitts.agentcore.exception.BackendNotReadyException;
import com.phillippitts.agentcore.exception.DuplicateBackendException;
import com.phillippitts.agentcore.exception.UnknownBackendException;
import com.phillippitts.agentcore.service.backend.event.BackendFailedEvent;
import com.phillippitts.agentcore.service.backend.event.BackendHealthChangedEvent;
import com.phillippitts.agentcore.service.backend.event.BackendReadyEvent;
import com.phillippitts.agentcore.service.backend.event.BackendSelectedEvent;
import com.phillippitts.agentcore.service.backend.transcription.TranscriptionProvider;
import com.phillippitts.agentcore.service.backend.transcription.TranscriptionRegistry;
import com.phillippitts.agentcore.service.metrics.OrchestrationMetricsPublisher;
import com.phillippitts.agentcore.testutil.EventCapturingPublisher;
import com.phillippitts.agentcore.testutil.FakeTranscriptionProvider;
import com.phillippitts.agentcore.testutil.MutableClock;
import com.phillippitts.agentcore.testutil.SyncExecutor;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BackendRegistryTest {

    private final EventCapturingPublisher events = new EventCapturingPublisher();
    private final MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    private final ExecutorService pool = Executors.newCachedThreadPool();

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    private TranscriptionRegistry registry(String preferred, Executor executor, Duration selectTimeout) {
        BackendRegistry.Settings settings = new BackendRegistry.Settings(preferred, selectTimeout, Duration.ofSeconds(5));
        return new TranscriptionRegistry(settings, executor, events, OrchestrationMetricsPublisher.NOOP, clock);
    }

    private TranscriptionRegistry syncRegistry(String preferred) {
        return registry(preferred, new SyncExecutor(), Duration.ofSeconds(1));
    }

    @Test
    void initializeAllSelectsPreferredWhenReady() {
        TranscriptionRegistry registry = syncRegistry("b");
        registry.register(new FakeTranscriptionProvider("a", "A"));
        registry.register(new FakeTranscriptionProvider("b", "B"));

        registry.initializeAll().join();

        assertThat(registry.selectedId()).contains("b");
        assertThat(registry.currentSelection().readiness()).isEqualTo(BackendReadiness.READY);
        assertThat(registry.health()).extracting(BackendStatus::readiness)
                .containsExactly(BackendReadiness.READY, BackendReadiness.READY);
        assertThat(events.eventsOf(BackendReadyEvent.class)).hasSize(2);
        assertThat(events.eventsOf(BackendSelectedEvent.class)).extracting(BackendSelectedEvent::backendId)
                .containsExactly("b");
    }

    @Test
    void failedPreferredFallsBackToFirstReady() {
        FakeTranscriptionProvider preferred = new FakeTranscriptionProvider("whisper", "w");
        preferred.failPrepare = true;
        TranscriptionRegistry registry = syncRegistry("whisper");
        registry.register(preferred);
        registry.register(new FakeTranscriptionProvider("backup", "b"));

        registry.initializeAll().join();

        assertThat(registry.selectedId()).contains("backup");
        assertThat(registry.status("whisper").readiness()).isEqualTo(BackendReadiness.FAILED);
        assertThat(registry.failureReason("whisper")).hasValueSatisfying(r -> assertThat(r).contains("model missing"));
        assertThat(events.eventsOf(BackendFailedEvent.class)).singleElement()
                .satisfies(e -> assertThat(e.backendId()).isEqualTo("whisper"));
    }

    @Test
    void selectingFailedProviderLeavesSelectionUnchanged() {
        FakeTranscriptionProvider broken = new FakeTranscriptionProvider("broken", "x");
        broken.failPrepare = true;
        TranscriptionRegistry registry = syncRegistry("ok");
        registry.register(new FakeTranscriptionProvider("ok", "ok"));
        registry.register(broken);
        registry.initializeAll().join();

        assertThatThrownBy(() -> registry.select("broken"))
                .isInstanceOf(BackendNotReadyException.class)
                .hasMessageContaining("model missing");
        assertThat(registry.selectedId()).contains("ok");
    }

    @Test
    void selectingUnknownIdThrows() {
        TranscriptionRegistry registry = syncRegistry(null);
        registry.register(new FakeTranscriptionProvider("a", "A"));

        assertThatThrownBy(() -> registry.select("nope")).isInstanceOf(UnknownBackendException.class);
        assertThatThrownBy(() -> registry.reinitialize("nope")).isInstanceOf(UnknownBackendException.class);
    }

    @Test
    void duplicateIdIsRejectedAndFirstRegistrationKept() {
        TranscriptionRegistry registry = syncRegistry(null);
        FakeTranscriptionProvider first = new FakeTranscriptionProvider("a", "first");
        registry.register(first);

        assertThatThrownBy(() -> registry.register(new FakeTranscriptionProvider("a", "second")))
                .isInstanceOf(DuplicateBackendException.class);
        registry.initializeAll().join();
        assertThat(registry.current()).isSameAs(first);
    }

    @Test
    void repeatedInitializationPreparesEachProviderOnce() {
        FakeTranscriptionProvider a = new FakeTranscriptionProvider("a", "A");
        TranscriptionRegistry registry = syncRegistry(null);
        registry.register(a);

        registry.initializeAll().join();
        registry.initializeAll().join();
        registry.select("a");

        assertThat(a.prepareCalls.get()).isEqualTo(1);
    }

    @Test
    void reinitializeRecoversFailedProvider() {
        FakeTranscriptionProvider flaky = new FakeTranscriptionProvider("flaky", "f");
        flaky.failPrepare = true;
        TranscriptionRegistry registry = syncRegistry(null);
        registry.register(flaky);
        registry.initializeAll().join();
        assertThat(registry.currentSelection().isUsable()).isFalse();

        flaky.failPrepare = false;
        BackendReadiness readiness = registry.reinitialize("flaky").join();

        assertThat(readiness).isEqualTo(BackendReadiness.READY);
        assertThat(registry.failureReason("flaky")).isEmpty();
        assertThat(registry.select("flaky")).isSameAs(flaky);
    }

    @Test
    void selectWaitsForInitializingProviderOnlyUpToTimeout() {
        FakeTranscriptionProvider slow = new FakeTranscriptionProvider("slow", "s");
        CountDownLatch gate = new CountDownLatch(1);
        slow.prepareGate = gate;
        TranscriptionRegistry registry = registry(null, pool, Duration.ofMillis(100));
        registry.register(slow);
        registry.initializeAll();

        assertThatThrownBy(() -> registry.select("slow"))
                .isInstanceOf(BackendNotReadyException.class)
                .hasMessageContaining("still initializing");

        gate.countDown();
        Awaitility.await().atMost(2, TimeUnit.SECONDS)
                .until(() -> registry.status("slow").readiness() == BackendReadiness.READY);
        assertThat(registry.select("slow")).isSameAs(slow);
    }

    @Test
    void userSelectionDuringInitializationSurvivesFallback() {
        FakeTranscriptionProvider preferred = new FakeTranscriptionProvider("whisper", "w");
        CountDownLatch gate = new CountDownLatch(1);
        preferred.prepareGate = gate;
        preferred.failPrepare = true;
        TranscriptionRegistry registry = registry("whisper", pool, Duration.ofSeconds(1));
        registry.register(preferred);
        registry.register(new FakeTranscriptionProvider("backup", "b"));
        registry.register(new FakeTranscriptionProvider("manual", "m"));
        CompletableFuture<Void> init = registry.initializeAll();
        Awaitility.await().atMost(2, TimeUnit.SECONDS)
                .until(() -> registry.status("manual").readiness() == BackendReadiness.READY);

        registry.select("manual");
        gate.countDown();
        init.join();

        assertThat(registry.selectedId()).contains("manual");
        assertThat(events.eventsOf(BackendSelectedEvent.class)).extracting(BackendSelectedEvent::backendId)
                .containsExactly("whisper", "manual");
    }

    @Test
    void switchingSelectionNeverClosesPreviousProvider() {
        FakeTranscriptionProvider a = new FakeTranscriptionProvider("a", "from a");
        FakeTranscriptionProvider b = new FakeTranscriptionProvider("b", "from b");
        TranscriptionRegistry registry = syncRegistry("a");
        registry.register(a);
        registry.register(b);
        registry.initializeAll().join();

        TranscriptionProvider inFlight = registry.current();
        registry.select("b");

        assertThat(inFlight.transcribe(new byte[0]).text()).isEqualTo("from a");
        assertThat(registry.current()).isSameAs(b);
        assertThat(a.closeCalls.get()).isZero();
    }

    @Test
    void staleProbeMovesReadyProviderToDegraded() {
        FakeTranscriptionProvider a = new FakeTranscriptionProvider("a", "A");
        TranscriptionRegistry registry = syncRegistry(null);
        registry.register(a);
        registry.initializeAll().join();

        a.healthy = false;
        assertThat(registry.status("a").readiness()).isEqualTo(BackendReadiness.READY);

        clock.advance(Duration.ofSeconds(6));
        BackendStatus status = registry.status("a");

        assertThat(status.readiness()).isEqualTo(BackendReadiness.DEGRADED);
        assertThat(status.lastProbe().reason()).isEqualTo("a unhealthy");
        assertThat(registry.currentSelection().isDegraded()).isTrue();
        assertThat(registry.currentSelection().isUsable()).isTrue();
        assertThat(events.eventsOf(BackendHealthChangedEvent.class)).singleElement()
                .satisfies(e -> assertThat(e.to()).isEqualTo(BackendReadiness.DEGRADED));
        assertThatThrownBy(() -> registry.select("a")).isInstanceOf(BackendNotReadyException.class);
    }

    @Test
    void emptyRegistryHasNoCurrentProvider() {
        TranscriptionRegistry registry = syncRegistry(null);

        registry.initializeAll().join();

        assertThatThrownBy(registry::current)
                .isInstanceOf(BackendNotReadyException.class)
                .hasMessageContaining("no providers registered");
    }

    @Test
    void closeClosesEveryProviderOnceAndRejectsRegistration() {
        FakeTranscriptionProvider a = new FakeTranscriptionProvider("a", "A");
        FakeTranscriptionProvider b = new FakeTranscriptionProvider("b", "B");
        TranscriptionRegistry registry = syncRegistry(null);
        registry.register(a);
        registry.register(b);
        registry.initializeAll().join();

        registry.close();
        registry.close();

        assertThat(a.closeCalls.get()).isEqualTo(1);
        assertThat(b.closeCalls.get()).isEqualTo(1);
        assertThatThrownBy(() -> registry.register(new FakeTranscriptionProvider("c", "C")))
                .isInstanceOf(IllegalStateException.class);
    }
}
