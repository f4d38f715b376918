package com.phillippitts.agentcore.service.agent;

import com.phillippitts.agentcore.domain.Turn;

/**
 * Receives each turn right after the loop appends it to the trace.
 */
@FunctionalInterface
public interface LoopListener {

    LoopListener NONE = turn -> { };

    void onTurn(Turn turn);
}
