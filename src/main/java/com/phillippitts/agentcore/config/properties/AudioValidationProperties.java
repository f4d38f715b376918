package com.phillippitts.agentcore.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Bounds applied to captured audio before transcription.
 */
@ConfigurationProperties(prefix = "audio.validation")
@Validated
public class AudioValidationProperties {

    @Positive(message = "Minimum duration must be positive")
    private int minDurationMs = 250;

    @Positive(message = "Maximum duration must be positive")
    private int maxDurationMs = 300_000;

    /** Guard against memory exhaustion from oversized uploads. */
    @Positive(message = "Maximum file size must be positive")
    private int maxFileSizeBytes = 100 * 1024 * 1024;

    public int getMinDurationMs() {
        return minDurationMs;
    }

    public void setMinDurationMs(int minDurationMs) {
        this.minDurationMs = minDurationMs;
    }

    public int getMaxDurationMs() {
        return maxDurationMs;
    }

    public void setMaxDurationMs(int maxDurationMs) {
        this.maxDurationMs = maxDurationMs;
    }

    public int getMaxFileSizeBytes() {
        return maxFileSizeBytes;
    }

    public void setMaxFileSizeBytes(int maxFileSizeBytes) {
        this.maxFileSizeBytes = maxFileSizeBytes;
    }
}
