package com.phillippitts.agentcore.domain;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutable, thread-safe record of one orchestration request.
 *
 * <p>Status only moves forward (see {@link RequestStatus#canTransitionTo}). Every accepted
 * transition and every appended turn produces a {@link ProgressEvent} with the next sequence
 * number; the record keeps that history so late subscribers can replay it.
 *
 * <p><b>Thread Safety:</b> state changes are guarded by a {@link ReentrantLock}; the
 * cancellation flag is a lock-free {@link AtomicBoolean} so the worker can poll it cheaply.
 */
public final class RequestRecord {

    private final String id;
    private final RequestInput input;
    private final Instant submittedAt;
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);

    private final Lock lock = new ReentrantLock();
    private RequestStatus status;
    private final List<Turn> trace = new ArrayList<>();
    private final List<ProgressEvent> events = new ArrayList<>();
    private long sequence;
    private Instant startedAt;
    private Instant finishedAt;
    private String result;
    private String failureReason;

    private RequestRecord(String id, RequestInput input) {
        this.id = Objects.requireNonNull(id, "id");
        this.input = Objects.requireNonNull(input, "input");
        this.submittedAt = Instant.now();
        this.status = RequestStatus.QUEUED;
    }

    /**
     * Creates a QUEUED record with a random id. The QUEUED event is not emitted here;
     * call {@link #queuedEvent()} once the record has been accepted.
     */
    public static RequestRecord create(RequestInput input) {
        return new RequestRecord(UUID.randomUUID().toString(), input);
    }

    public String id() {
        return id;
    }

    public RequestInput input() {
        return input;
    }

    /**
     * Emits the initial QUEUED event. Only valid while the record is still QUEUED and
     * has not emitted anything yet.
     */
    public ProgressEvent queuedEvent() {
        lock.lock();
        try {
            if (status != RequestStatus.QUEUED || !events.isEmpty()) {
                throw new IllegalStateException("Request " + id + " already announced");
            }
            return emit(ProgressEventType.QUEUED, null, null);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Attempts a status transition.
     *
     * @param next target status
     * @param message answer text for SUCCEEDED, reason for FAILED/CANCELLED, or {@code null}
     * @return the emitted event, or empty when the transition is not allowed from the current status
     */
    public Optional<ProgressEvent> tryTransition(RequestStatus next, String message) {
        lock.lock();
        try {
            if (!status.canTransitionTo(next)) {
                return Optional.empty();
            }
            status = next;
            Instant now = Instant.now();
            if (next == RequestStatus.RUNNING) {
                startedAt = now;
            }
            if (next.isTerminal()) {
                finishedAt = now;
                if (next == RequestStatus.SUCCEEDED) {
                    result = message;
                } else {
                    failureReason = message;
                }
            }
            return Optional.of(emit(ProgressEventType.forStatus(next), null, message));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Appends a turn to the trace. Only legal while RUNNING.
     *
     * @throws IllegalStateException if the request is not running
     */
    public ProgressEvent appendTurn(Turn turn) {
        Objects.requireNonNull(turn, "turn");
        lock.lock();
        try {
            if (status != RequestStatus.RUNNING) {
                throw new IllegalStateException("Cannot append turn to request " + id + " in status " + status);
            }
            trace.add(turn);
            return emit(ProgressEventType.TURN, turn, null);
        } finally {
            lock.unlock();
        }
    }

    /** Flags the request for cooperative cancellation. */
    public void requestCancel() {
        cancelRequested.set(true);
    }

    public boolean isCancelRequested() {
        return cancelRequested.get();
    }

    public RequestStatus status() {
        lock.lock();
        try {
            return status;
        } finally {
            lock.unlock();
        }
    }

    /** Returns a copy of every event emitted so far, in sequence order. */
    public List<ProgressEvent> events() {
        lock.lock();
        try {
            return List.copyOf(events);
        } finally {
            lock.unlock();
        }
    }

    public RequestSnapshot snapshot() {
        lock.lock();
        try {
            return new RequestSnapshot(id, input, status, trace, result, failureReason,
                    submittedAt, startedAt, finishedAt);
        } finally {
            lock.unlock();
        }
    }

    private ProgressEvent emit(ProgressEventType type, Turn turn, String message) {
        ProgressEvent event = new ProgressEvent(id, ++sequence, type, status, turn, message, Instant.now());
        events.add(event);
        return event;
    }
}
