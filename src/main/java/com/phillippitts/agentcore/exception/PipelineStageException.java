package com.phillippitts.agentcore.exception;

import com.phillippitts.agentcore.domain.PipelineStage;

import java.util.Objects;

/**
 * Uniform failure of one speech pipeline stage.
 *
 * <p>{@code terminal} tells the caller whether retrying the same request could succeed:
 * {@code true} for input or configuration problems (invalid audio, empty transcript,
 * backend not ready), {@code false} for transient problems such as timeouts.
 */
public class PipelineStageException extends AgentCoreException {

    private final PipelineStage stage;
    private final boolean terminal;

    public PipelineStageException(PipelineStage stage, String message, Throwable cause, boolean terminal) {
        super(Objects.requireNonNull(stage, "stage").wireName() + " stage failed: " + message, cause);
        this.stage = stage;
        this.terminal = terminal;
    }

    public PipelineStage getStage() {
        return stage;
    }

    public boolean isTerminal() {
        return terminal;
    }
}
