package com.phillippitts.agentcore.domain;

import java.util.Objects;

/**
 * Input of one speech pipeline run.
 *
 * @param audio captured audio, WAV or raw PCM16LE mono 16 kHz
 * @param voice optional voice hint for synthesis; {@code null} for the backend default
 * @param autoSpeak whether to synthesize the response
 */
public record PipelineRequest(byte[] audio, String voice, boolean autoSpeak) {

    public PipelineRequest {
        Objects.requireNonNull(audio, "audio must not be null");
    }

    public static PipelineRequest of(byte[] audio) {
        return new PipelineRequest(audio, null, true);
    }
}
