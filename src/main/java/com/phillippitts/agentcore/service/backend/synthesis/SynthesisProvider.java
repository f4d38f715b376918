package com.phillippitts.agentcore.service.backend.synthesis;

import com.phillippitts.agentcore.domain.SynthesisResult;
import com.phillippitts.agentcore.service.backend.BackendProvider;

/**
 * Text-to-speech provider. Local playback is a separate capability, see {@link AudioPlayback}.
 */
public interface SynthesisProvider extends BackendProvider {

    /**
     * Synthesizes speech for the given text.
     *
     * @param text text to speak (non-blank)
     * @param voice optional voice hint; {@code null} for the provider default
     * @throws com.phillippitts.agentcore.exception.BackendOperationException on failure
     */
    SynthesisResult synthesize(String text, String voice);
}
