package com.phillippitts.agentcore.service.delegate;

import com.phillippitts.agentcore.domain.SynthesisResult;
import com.phillippitts.agentcore.exception.AgentCoreException;
import com.phillippitts.agentcore.exception.DelegateFailureException;
import com.phillippitts.agentcore.service.backend.BackendRegistry;
import com.phillippitts.agentcore.service.backend.synthesis.AudioPlayback;
import com.phillippitts.agentcore.service.backend.synthesis.SynthesisProvider;
import com.phillippitts.agentcore.service.backend.synthesis.SynthesisRegistry;

import java.util.Map;
import java.util.Objects;

/**
 * Speaks text aloud through the currently selected synthesis backend.
 * Takes {@code {"text": "..."}} (or {@code {"query": "..."}}).
 */
public class SpeakDelegate implements Delegate {

    public static final String NAME = "speak";

    private final SynthesisRegistry registry;

    public SpeakDelegate(SynthesisRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return "Speak text aloud to the user. Arguments: {\"text\": \"<what to say>\"}";
    }

    @Override
    public String invoke(Map<String, Object> arguments) {
        Object text = arguments.containsKey("text") ? arguments.get("text") : arguments.get("query");
        if (text == null || String.valueOf(text).isBlank()) {
            throw new DelegateFailureException("invalid_arguments", "speak requires non-blank \"text\"");
        }
        BackendRegistry.Selection<SynthesisProvider> selection;
        try {
            selection = registry.currentSelection();
        } catch (AgentCoreException e) {
            throw new DelegateFailureException("backend_not_ready", e.getMessage(), e);
        }
        if (!selection.isUsable()) {
            throw new DelegateFailureException("backend_not_ready",
                    "synthesis backend " + selection.id() + " is " + selection.readiness());
        }
        SynthesisProvider provider = selection.provider();
        try {
            SynthesisResult audio = provider.synthesize(String.valueOf(text), null);
            if (provider instanceof AudioPlayback playback) {
                playback.play(audio);
                return "Spoke " + String.valueOf(text).length() + " chars via " + provider.id();
            }
            return "Synthesized " + audio.sizeBytes() + " bytes via " + provider.id() + " (no local playback)";
        } catch (AgentCoreException e) {
            throw new DelegateFailureException("synthesis_failed", e.getMessage(), e);
        }
    }
}
