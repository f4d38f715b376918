package com.phillippitts.agentcore.testutil;

import com.phillippitts.agentcore.domain.HealthProbe;
import com.phillippitts.agentcore.domain.TranscriptionResult;
import com.phillippitts.agentcore.exception.BackendOperationException;
import com.phillippitts.agentcore.service.backend.AbstractBackendProvider;
import com.phillippitts.agentcore.service.backend.transcription.TranscriptionProvider;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test double for TranscriptionProvider with configurable output.
 *
 * <p>Mutable fields are public so tests can flip behavior between calls:
 * {@code cannedText}, {@code healthy}, {@code failPrepare}, {@code delayMs}.
 * {@code prepareGate} blocks preparation until counted down, to hold a provider INITIALIZING.
 */
public class FakeTranscriptionProvider extends AbstractBackendProvider implements TranscriptionProvider {
    private final String id;
    public volatile String cannedText;
    public volatile boolean healthy = true;
    public volatile boolean failPrepare;
    public volatile long delayMs;
    public volatile CountDownLatch prepareGate;
    public final AtomicInteger prepareCalls = new AtomicInteger();
    public final AtomicInteger transcribeCalls = new AtomicInteger();
    public final AtomicInteger closeCalls = new AtomicInteger();

    public FakeTranscriptionProvider(String id, String cannedText) {
        this.id = id;
        this.cannedText = cannedText;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String displayName() {
        return "Fake " + id;
    }

    @Override
    protected void doPrepare() {
        prepareCalls.incrementAndGet();
        CountDownLatch gate = prepareGate;
        if (gate != null) {
            try {
                gate.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (failPrepare) {
            throw new IllegalStateException("model missing for " + id);
        }
    }

    @Override
    protected HealthProbe doHealthCheck() {
        return healthy ? HealthProbe.up() : HealthProbe.down(id + " unhealthy", "restart it");
    }

    @Override
    protected void doClose() {
        closeCalls.incrementAndGet();
    }

    @Override
    public TranscriptionResult transcribe(byte[] audio) {
        transcribeCalls.incrementAndGet();
        if (delayMs > 0) {
            try {
                Thread.sleep(delayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new BackendOperationException("interrupted", id, e);
            }
        }
        return TranscriptionResult.of(cannedText, 1.0, id);
    }
}
