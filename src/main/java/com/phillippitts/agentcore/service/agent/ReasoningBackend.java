package com.phillippitts.agentcore.service.agent;

import com.phillippitts.agentcore.domain.Turn;

/**
 * Produces the next {@link Turn} for a reasoning loop iteration (typically an LLM call).
 */
public interface ReasoningBackend {

    /**
     * @throws com.phillippitts.agentcore.exception.MalformedTurnException if the reply cannot be read as a turn
     * @throws com.phillippitts.agentcore.exception.ReasoningBackendException if the backend call itself fails
     */
    Turn complete(ReasoningContext context);
}
