package com.phillippitts.agentcore.domain;

/**
 * What a single reasoning turn asks the loop to do next.
 */
public enum TurnAction {
    /** Invoke exactly one delegate with structured arguments. */
    TOOL,
    /** Stop with a final answer. */
    ANSWER;

    /**
     * Parses the wire value produced by a reasoning backend ("tool" / "answer", case-insensitive).
     *
     * @param raw raw action value
     * @return parsed action, or {@code null} when the value is not recognised
     */
    public static TurnAction fromWire(String raw) {
        if (raw == null) {
            return null;
        }
        return switch (raw.trim().toLowerCase()) {
            case "tool", "delegate", "tool_call" -> TOOL;
            case "answer", "final", "final_answer" -> ANSWER;
            default -> null;
        };
    }
}
