package com.phillippitts.agentcore.domain;

/**
 * States of the reasoning loop.
 *
 * <pre>
 * OBSERVE → PLAN → ACT → DELEGATE_CALL → OBSERVE ...
 *                      → FINAL
 * any → ERROR | BUDGET_EXCEEDED | CANCELLED
 * </pre>
 */
public enum LoopState {
    OBSERVE,
    PLAN,
    ACT,
    DELEGATE_CALL,
    FINAL,
    ERROR,
    BUDGET_EXCEEDED,
    CANCELLED;

    public boolean isTerminal() {
        return this == FINAL || this == ERROR || this == BUDGET_EXCEEDED || this == CANCELLED;
    }
}
