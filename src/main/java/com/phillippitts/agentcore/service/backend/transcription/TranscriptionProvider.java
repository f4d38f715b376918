package com.phillippitts.agentcore.service.backend.transcription;

import com.phillippitts.agentcore.domain.TranscriptionResult;
import com.phillippitts.agentcore.service.backend.BackendProvider;

/**
 * Speech-to-text provider.
 */
public interface TranscriptionProvider extends BackendProvider {

    /**
     * Transcribes one complete clip.
     *
     * @param audio WAV or raw PCM16LE mono 16 kHz
     * @return transcription (text may be empty for silence)
     * @throws com.phillippitts.agentcore.exception.BackendOperationException on failure
     */
    TranscriptionResult transcribe(byte[] audio);
}
