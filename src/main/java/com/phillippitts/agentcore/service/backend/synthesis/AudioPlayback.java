package com.phillippitts.agentcore.service.backend.synthesis;

import com.phillippitts.agentcore.domain.SynthesisResult;

/**
 * Plays synthesized audio on a local output device. Blocks until playback finishes.
 */
public interface AudioPlayback {

    /**
     * @throws com.phillippitts.agentcore.exception.BackendOperationException if the audio cannot be played
     */
    void play(SynthesisResult audio);
}
