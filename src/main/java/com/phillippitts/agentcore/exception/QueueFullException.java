package com.phillippitts.agentcore.exception;

/**
 * Thrown by {@code submit} when the orchestration queue is at its configured capacity.
 */
public class QueueFullException extends AgentCoreException {

    private final int capacity;

    public QueueFullException(int capacity) {
        super("Orchestration queue is full (capacity " + capacity + ")");
        this.capacity = capacity;
    }

    public int getCapacity() {
        return capacity;
    }
}
