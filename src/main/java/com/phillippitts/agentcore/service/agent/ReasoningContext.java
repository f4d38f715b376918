package com.phillippitts.agentcore.service.agent;

import com.phillippitts.agentcore.domain.RequestInput;
import com.phillippitts.agentcore.domain.Turn;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything the reasoning backend sees for one iteration.
 *
 * @param input the request being worked on
 * @param observation latest observation: the request text on the first iteration, otherwise the
 *                    previous delegate result or failure text
 * @param trace turns produced so far, oldest first
 * @param iteration 1-based iteration number
 * @param maxIterations iteration budget
 * @param delegates available delegate names and descriptions
 */
public record ReasoningContext(
        RequestInput input,
        String observation,
        List<Turn> trace,
        int iteration,
        int maxIterations,
        Map<String, String> delegates
) {
    public ReasoningContext {
        Objects.requireNonNull(input, "input");
        observation = observation == null ? "" : observation;
        trace = trace == null ? List.of() : List.copyOf(trace);
        delegates = delegates == null ? Map.of() : delegates;
    }

    public int remainingIterations() {
        return maxIterations - iteration + 1;
    }
}
