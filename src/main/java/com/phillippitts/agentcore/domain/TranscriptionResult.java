package com.phillippitts.agentcore.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Text produced by a transcription backend.
 *
 * <p>Empty text is valid at this level (silence); the speech pipeline decides whether an
 * empty transcript is an error.
 *
 * @param text transcribed text (never null)
 * @param confidence confidence between 0.0 and 1.0; backends without scores report 1.0
 * @param timestamp when the transcription finished
 * @param backendId id of the provider that produced it
 */
public record TranscriptionResult(
        String text,
        double confidence,
        Instant timestamp,
        String backendId
) {

    public TranscriptionResult {
        Objects.requireNonNull(text, "Transcription text must not be null");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
        Objects.requireNonNull(timestamp, "Timestamp must not be null");
        Objects.requireNonNull(backendId, "Backend id must not be null");
    }

    public static TranscriptionResult of(String text, double confidence, String backendId) {
        return new TranscriptionResult(text, confidence, Instant.now(), backendId);
    }

    public boolean isBlank() {
        return text.isBlank();
    }
}
