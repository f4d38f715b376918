package com.phillippitts.agentcore.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Speech pipeline stage timeouts and defaults.
 */
@ConfigurationProperties(prefix = "pipeline")
@Validated
public class PipelineProperties {

    @Positive
    private long transcriptionTimeoutMs = 60_000;

    /** Covers queue wait plus the reasoning loop run. */
    @Positive
    private long reasoningTimeoutMs = 300_000;

    @Positive
    private long synthesisTimeoutMs = 60_000;

    /** Default for requests that do not say whether to synthesize the response. */
    private boolean autoSpeak = true;

    /** Play synthesized responses on the local output device when the backend supports it. */
    private boolean playLocally = false;

    public long getTranscriptionTimeoutMs() {
        return transcriptionTimeoutMs;
    }

    public void setTranscriptionTimeoutMs(long transcriptionTimeoutMs) {
        this.transcriptionTimeoutMs = transcriptionTimeoutMs;
    }

    public long getReasoningTimeoutMs() {
        return reasoningTimeoutMs;
    }

    public void setReasoningTimeoutMs(long reasoningTimeoutMs) {
        this.reasoningTimeoutMs = reasoningTimeoutMs;
    }

    public long getSynthesisTimeoutMs() {
        return synthesisTimeoutMs;
    }

    public void setSynthesisTimeoutMs(long synthesisTimeoutMs) {
        this.synthesisTimeoutMs = synthesisTimeoutMs;
    }

    public boolean isAutoSpeak() {
        return autoSpeak;
    }

    public void setAutoSpeak(boolean autoSpeak) {
        this.autoSpeak = autoSpeak;
    }

    public boolean isPlayLocally() {
        return playLocally;
    }

    public void setPlayLocally(boolean playLocally) {
        this.playLocally = playLocally;
    }
}
