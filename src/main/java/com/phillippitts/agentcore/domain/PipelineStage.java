package com.phillippitts.agentcore.domain;

/** Stages of the speech pipeline, in execution order. */
public enum PipelineStage {
    CAPTURE,
    TRANSCRIPTION,
    REASONING,
    SYNTHESIS;

    /** Lower-case name used in logs and API errors. */
    public String wireName() {
        return name().toLowerCase();
    }
}
