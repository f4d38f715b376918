package com.phillippitts.agentcore.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Orchestration queue limits.
 */
@ConfigurationProperties(prefix = "agent.queue")
@Validated
public class QueueProperties {

    /** Maximum number of waiting (not yet running) requests; 0 means unbounded. */
    @PositiveOrZero
    private int capacity = 0;

    /** Finished requests kept for snapshots and replay; oldest are evicted first. */
    @Min(1)
    private int retainedRecords = 100;

    public QueueProperties() {
    }

    public QueueProperties(int capacity, int retainedRecords) {
        this.capacity = capacity;
        this.retainedRecords = retainedRecords;
    }

    public int getCapacity() {
        return capacity;
    }

    public void setCapacity(int capacity) {
        this.capacity = capacity;
    }

    public int getRetainedRecords() {
        return retainedRecords;
    }

    public void setRetainedRecords(int retainedRecords) {
        this.retainedRecords = retainedRecords;
    }
}
