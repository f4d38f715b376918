package com.phillippitts.agentcore.domain;

/** Kinds of progress events emitted for a request. */
public enum ProgressEventType {
    QUEUED,
    STARTED,
    TURN,
    SUCCEEDED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }

    static ProgressEventType forStatus(RequestStatus status) {
        return switch (status) {
            case QUEUED -> QUEUED;
            case RUNNING -> STARTED;
            case SUCCEEDED -> SUCCEEDED;
            case FAILED -> FAILED;
            case CANCELLED -> CANCELLED;
        };
    }
}
