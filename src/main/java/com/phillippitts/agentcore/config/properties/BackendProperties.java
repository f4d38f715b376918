package com.phillippitts.agentcore.config.properties;

import com.phillippitts.agentcore.service.backend.BackendRegistry;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Backend registry settings shared by both families, plus the preferred provider per family.
 */
@ConfigurationProperties(prefix = "backend")
@Validated
public class BackendProperties {

    private Family transcription = new Family("whisper-cpp");
    private Family synthesis = new Family("piper");

    /** How long {@code select} waits for a provider that is still initializing. */
    @Positive
    private long selectTimeoutMs = 30_000;

    @Positive
    private long healthCacheTtlMs = 5_000;

    /** Period of the scheduled health refresh and summary log. */
    @Positive
    private long healthRefreshMs = 60_000;

    public BackendRegistry.Settings settingsFor(Family family) {
        return new BackendRegistry.Settings(family.getPreferred(),
                Duration.ofMillis(selectTimeoutMs), Duration.ofMillis(healthCacheTtlMs));
    }

    public Family getTranscription() {
        return transcription;
    }

    public void setTranscription(Family transcription) {
        this.transcription = transcription;
    }

    public Family getSynthesis() {
        return synthesis;
    }

    public void setSynthesis(Family synthesis) {
        this.synthesis = synthesis;
    }

    public long getSelectTimeoutMs() {
        return selectTimeoutMs;
    }

    public void setSelectTimeoutMs(long selectTimeoutMs) {
        this.selectTimeoutMs = selectTimeoutMs;
    }

    public long getHealthCacheTtlMs() {
        return healthCacheTtlMs;
    }

    public void setHealthCacheTtlMs(long healthCacheTtlMs) {
        this.healthCacheTtlMs = healthCacheTtlMs;
    }

    public long getHealthRefreshMs() {
        return healthRefreshMs;
    }

    public void setHealthRefreshMs(long healthRefreshMs) {
        this.healthRefreshMs = healthRefreshMs;
    }

    public static class Family {
        /** Provider id selected after initialization when it is READY. */
        private String preferred;

        public Family() {
        }

        Family(String preferred) {
            this.preferred = preferred;
        }

        public String getPreferred() {
            return preferred;
        }

        public void setPreferred(String preferred) {
            this.preferred = preferred;
        }
    }
}
