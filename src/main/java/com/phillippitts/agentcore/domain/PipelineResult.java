package com.phillippitts.agentcore.domain;

import java.util.Map;

/**
 * Outcome of a successful speech pipeline run.
 *
 * @param requestId id of the orchestration request used for the reasoning stage
 * @param transcript transcribed user text
 * @param response final answer of the reasoning stage
 * @param speech synthesized response audio; {@code null} when synthesis was skipped
 * @param backends provider id used per stage (transcription, synthesis)
 * @param degraded whether any stage ran against a DEGRADED backend
 */
public record PipelineResult(
        String requestId,
        String transcript,
        String response,
        SynthesisResult speech,
        Map<PipelineStage, String> backends,
        boolean degraded
) {
    public PipelineResult {
        backends = backends == null ? Map.of() : Map.copyOf(backends);
    }
}
