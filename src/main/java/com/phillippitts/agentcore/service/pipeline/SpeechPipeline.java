package com.phillippitts.agentcore.service.pipeline;

import com.phillippitts.agentcore.domain.PipelineRequest;
import com.phillippitts.agentcore.domain.PipelineResult;

/**
 * Capture → transcribe → reason → synthesize as one call.
 */
public interface SpeechPipeline {

    /**
     * Runs all stages in order; a failing stage stops the run.
     *
     * @throws com.phillippitts.agentcore.exception.PipelineStageException naming the failed stage
     */
    PipelineResult process(PipelineRequest request);
}
