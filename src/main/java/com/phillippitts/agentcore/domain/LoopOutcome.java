package com.phillippitts.agentcore.domain;

import java.util.List;
import java.util.Objects;

/**
 * Terminal result of one reasoning loop run.
 *
 * @param state terminal state (FINAL, ERROR, BUDGET_EXCEEDED or CANCELLED)
 * @param text final answer for FINAL, otherwise the non-blank reason
 * @param trace every turn produced during the run
 */
public record LoopOutcome(LoopState state, String text, List<Turn> trace) {

    public LoopOutcome {
        Objects.requireNonNull(state, "state");
        if (!state.isTerminal()) {
            throw new IllegalArgumentException("Outcome state must be terminal, got " + state);
        }
        if (state != LoopState.FINAL && (text == null || text.isBlank())) {
            throw new IllegalArgumentException(state + " outcome requires a reason");
        }
        text = text == null ? "" : text;
        trace = trace == null ? List.of() : List.copyOf(trace);
    }

    public static LoopOutcome finalAnswer(String answer, List<Turn> trace) {
        return new LoopOutcome(LoopState.FINAL, answer, trace);
    }

    public static LoopOutcome error(String reason, List<Turn> trace) {
        return new LoopOutcome(LoopState.ERROR, reason, trace);
    }

    public static LoopOutcome budgetExceeded(String reason, List<Turn> trace) {
        return new LoopOutcome(LoopState.BUDGET_EXCEEDED, reason, trace);
    }

    public static LoopOutcome cancelled(String reason, List<Turn> trace) {
        return new LoopOutcome(LoopState.CANCELLED, reason, trace);
    }

    public boolean isFinal() {
        return state == LoopState.FINAL;
    }
}
