package com.phillippitts.agentcore.testutil;

import com.phillippitts.agentcore.domain.SynthesisResult;
import com.phillippitts.agentcore.service.backend.AbstractBackendProvider;
import com.phillippitts.agentcore.service.backend.synthesis.AudioPlayback;
import com.phillippitts.agentcore.service.backend.synthesis.SynthesisProvider;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Test double for SynthesisProvider that records what it was asked to say and play.
 */
public class FakeSynthesisProvider extends AbstractBackendProvider implements SynthesisProvider, AudioPlayback {
    private final String id;
    public final List<String> spoken = new CopyOnWriteArrayList<>();
    public final List<SynthesisResult> played = new CopyOnWriteArrayList<>();
    public volatile boolean failPrepare;

    public FakeSynthesisProvider(String id) {
        this.id = id;
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
        if (failPrepare) {
            throw new IllegalStateException("voice missing for " + id);
        }
    }

    @Override
    protected void doClose() {
    }

    @Override
    public SynthesisResult synthesize(String text, String voice) {
        spoken.add(text);
        return SynthesisResult.wav(text.getBytes(StandardCharsets.UTF_8), id);
    }

    @Override
    public void play(SynthesisResult audio) {
        played.add(audio);
    }
}
