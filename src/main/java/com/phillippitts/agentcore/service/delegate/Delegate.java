package com.phillippitts.agentcore.service.delegate;

import java.util.Map;

/**
 * A named capability the reasoning loop can call: a plain tool or a nested sub-agent.
 *
 * <p>Implementations must be safe to call from the delegate executor and should respond to
 * thread interruption, which is how timed-out calls are abandoned.
 */
public interface Delegate {

    /** Unique key used for dispatch. */
    String name();

    /** Shown to the reasoning backend so it can choose between delegates. Not used for dispatch. */
    String description();

    /**
     * Performs the call.
     *
     * @param arguments structured arguments from the turn (never null, possibly empty)
     * @return observation text for the next turn
     * @throws com.phillippitts.agentcore.exception.DelegateFailureException for expected, structured failures
     */
    String invoke(Map<String, Object> arguments);
}
