package com.phillippitts.agentcore.domain;

import java.util.List;
import java.util.Objects;

/**
 * One observe/plan/act step produced by the reasoning backend.
 *
 * <p>A turn either requests a delegate call ({@link TurnAction#TOOL}) or carries the final
 * answer ({@link TurnAction#ANSWER}). Turns are immutable; the loop appends them to the trace
 * and never edits one after it was produced.
 *
 * @param observation what the turn observed (the previous delegate result or the request input)
 * @param plan advisory plan steps, in order (may be empty)
 * @param action requested action
 * @param delegateCall delegate call for {@code TOOL}; {@code null} for {@code ANSWER}
 * @param answer answer text for {@code ANSWER}; {@code null} for {@code TOOL}
 */
public record Turn(
        String observation,
        List<String> plan,
        TurnAction action,
        DelegateCall delegateCall,
        String answer
) {

    public Turn {
        observation = observation == null ? "" : observation;
        plan = plan == null ? List.of() : List.copyOf(plan);
        Objects.requireNonNull(action, "action must not be null");
        if (action == TurnAction.TOOL && delegateCall == null) {
            throw new IllegalArgumentException("TOOL turn requires a delegate call");
        }
        if (action == TurnAction.ANSWER && answer == null) {
            throw new IllegalArgumentException("ANSWER turn requires answer text");
        }
    }

    public static Turn tool(String observation, List<String> plan, DelegateCall call) {
        return new Turn(observation, plan, TurnAction.TOOL, call, null);
    }

    public static Turn answer(String observation, List<String> plan, String answer) {
        return new Turn(observation, plan, TurnAction.ANSWER, null, answer);
    }

    /**
     * Returns a copy of this turn whose observation is replaced by the given text.
     */
    public Turn withObservation(String newObservation) {
        return new Turn(newObservation, plan, action, delegateCall, answer);
    }

    public boolean isAnswer() {
        return action == TurnAction.ANSWER;
    }
}
