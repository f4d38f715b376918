package com.phillippitts.agentcore.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Audio produced by a synthesis backend.
 *
 * @param audio encoded audio bytes (WAV for the bundled providers)
 * @param mediaType MIME type of {@code audio}, e.g. {@code audio/wav}
 * @param backendId id of the provider that produced it
 * @param timestamp when synthesis finished
 */
public record SynthesisResult(byte[] audio, String mediaType, String backendId, Instant timestamp) {

    public SynthesisResult {
        Objects.requireNonNull(audio, "audio must not be null");
        Objects.requireNonNull(mediaType, "mediaType must not be null");
        Objects.requireNonNull(backendId, "backendId must not be null");
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }

    public static SynthesisResult wav(byte[] audio, String backendId) {
        return new SynthesisResult(audio, "audio/wav", backendId, Instant.now());
    }

    public int sizeBytes() {
        return audio.length;
    }
}
