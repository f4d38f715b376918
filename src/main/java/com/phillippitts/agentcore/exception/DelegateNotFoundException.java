package com.phillippitts.agentcore.exception;

import java.util.List;

/**
 * Thrown when a turn names a delegate that is not in the delegate table.
 * The reasoning loop turns this into a terminal ERROR outcome.
 */
public class DelegateNotFoundException extends AgentCoreException {

    private final String delegateName;
    private final List<String> available;

    public DelegateNotFoundException(String delegateName, List<String> available) {
        super("Delegate not found: " + delegateName + " (available: "
                + (available.isEmpty() ? "none" : String.join(", ", available)) + ")");
        this.delegateName = delegateName;
        this.available = List.copyOf(available);
    }

    public String getDelegateName() {
        return delegateName;
    }

    public List<String> getAvailable() {
        return available;
    }
}
