package com.phillippitts.agentcore.service.queue;

import com.phillippitts.agentcore.config.properties.QueueProperties;
import com.phillippitts.agentcore.domain.LoopOutcome;
import com.phillippitts.agentcore.domain.ProgressEvent;
import com.phillippitts.agentcore.domain.RequestInput;
import com.phillippitts.agentcore.domain.RequestRecord;
import com.phillippitts.agentcore.domain.RequestSnapshot;
import com.phillippitts.agentcore.domain.RequestStatus;
import com.phillippitts.agentcore.exception.QueueFullException;
import com.phillippitts.agentcore.exception.RequestNotFoundException;
import com.phillippitts.agentcore.service.agent.LoopBudget;
import com.phillippitts.agentcore.service.agent.ReasoningLoop;
import com.phillippitts.agentcore.service.delegate.DelegateTable;
import com.phillippitts.agentcore.service.metrics.OrchestrationMetricsPublisher;
import com.phillippitts.agentcore.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;

/**
 * {@link OrchestrationQueue} with one worker draining a FIFO into the {@link ReasoningLoop}.
 *
 * <p>Every transition and every turn is published through the {@link ProgressBroadcaster} on the
 * thread making it, before the request's completion future completes. Finished records are kept
 * for snapshots until evicted, oldest first, beyond {@link QueueProperties#getRetainedRecords()}.
 */
public class DefaultOrchestrationQueue implements OrchestrationQueue {

    private static final Logger LOG = LogManager.getLogger(DefaultOrchestrationQueue.class);
    private static final long POLL_MILLIS = 250;

    private final ReasoningLoop loop;
    private final DelegateTable delegates;
    private final LoopBudget budget;
    private final QueueProperties props;
    private final Executor workerExecutor;
    private final OrchestrationMetricsPublisher metrics;
    private final ProgressBroadcaster broadcaster;

    private final BlockingDeque<RequestRecord> pending = new LinkedBlockingDeque<>();
    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final ConcurrentLinkedQueue<String> finishedOrder = new ConcurrentLinkedQueue<>();
    private final RunningSlot slot = new RunningSlot();
    private final Object submitLock = new Object();

    private volatile boolean running;
    private volatile Thread workerThread;

    private record Entry(RequestRecord record, CompletableFuture<RequestSnapshot> completion) {
    }

    public DefaultOrchestrationQueue(ReasoningLoop loop,
                                     DelegateTable delegates,
                                     LoopBudget budget,
                                     QueueProperties props,
                                     Executor workerExecutor,
                                     ApplicationEventPublisher publisher,
                                     OrchestrationMetricsPublisher metrics) {
        this.loop = Objects.requireNonNull(loop, "loop");
        this.delegates = Objects.requireNonNull(delegates, "delegates");
        this.budget = Objects.requireNonNull(budget, "budget");
        this.props = Objects.requireNonNull(props, "props");
        this.workerExecutor = Objects.requireNonNull(workerExecutor, "workerExecutor");
        this.metrics = metrics != null ? metrics : OrchestrationMetricsPublisher.NOOP;
        this.broadcaster = new ProgressBroadcaster(publisher);
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        workerExecutor.execute(this::workerLoop);
        LOG.info("Orchestration queue started (capacity={}, retained={}, delegates={})",
                props.getCapacity() == 0 ? "unbounded" : props.getCapacity(),
                props.getRetainedRecords(), delegates.names());
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        // the running request ends CANCELLED at its next turn boundary
        slot.current().map(entries::get).ifPresent(entry -> entry.record().requestCancel());
        Thread worker = workerThread;
        if (worker != null) {
            worker.interrupt();
        }
        List<RequestRecord> left = new ArrayList<>();
        pending.drainTo(left);
        for (RequestRecord record : left) {
            record.tryTransition(RequestStatus.CANCELLED, "Queue stopped").ifPresent(e -> finish(record, e));
        }
        LOG.info("Orchestration queue stopped ({} waiting request(s) cancelled)", left.size());
    }

    @Override
    public RequestTicket submit(RequestInput input) {
        Objects.requireNonNull(input, "input");
        if (!running) {
            throw new IllegalStateException("Orchestration queue is not running");
        }
        RequestRecord record = RequestRecord.create(input);
        CompletableFuture<RequestSnapshot> completion = new CompletableFuture<>();
        synchronized (submitLock) {
            int capacity = props.getCapacity();
            if (capacity > 0 && pending.size() >= capacity) {
                throw new QueueFullException(capacity);
            }
            entries.put(record.id(), new Entry(record, completion));
            broadcaster.publish(record.queuedEvent());
            pending.addLast(record);
        }
        LOG.info("Request {} queued (depth={}, chars={})", record.id(), pending.size(), input.text().length());
        LOG.debug("Request {} text: '{}'", record.id(), LogSanitizer.preview(input.text()));
        return new RequestTicket(record.id(), completion);
    }

    @Override
    public boolean cancel(String requestId) {
        RequestRecord record = require(requestId).record();
        Optional<ProgressEvent> cancelled = record.tryTransition(RequestStatus.CANCELLED, "Cancelled before start");
        if (cancelled.isPresent()) {
            pending.remove(record);
            LOG.info("Request {} cancelled while queued", requestId);
            finish(record, cancelled.get());
            return true;
        }
        if (record.status() == RequestStatus.RUNNING) {
            record.requestCancel();
            LOG.info("Request {} cancellation requested; stops at next turn boundary", requestId);
            return true;
        }
        return false;
    }

    @Override
    public RequestSnapshot snapshot(String requestId) {
        return require(requestId).record().snapshot();
    }

    @Override
    public Subscription subscribe(String requestId, ProgressSubscriber subscriber) {
        Objects.requireNonNull(subscriber, "subscriber");
        RequestRecord record = require(requestId).record();
        return broadcaster.addReplaying(requestId, subscriber, record::events);
    }

    @Override
    public Subscription subscribeAll(ProgressSubscriber subscriber) {
        return broadcaster.addGlobal(Objects.requireNonNull(subscriber, "subscriber"));
    }

    @Override
    public Optional<String> runningRequestId() {
        return slot.current();
    }

    @Override
    public int depth() {
        return pending.size();
    }

    private Entry require(String requestId) {
        Entry entry = requestId == null ? null : entries.get(requestId);
        if (entry == null) {
            throw new RequestNotFoundException(requestId);
        }
        return entry;
    }

    private void workerLoop() {
        workerThread = Thread.currentThread();
        LOG.debug("Queue worker started on {}", workerThread.getName());
        try {
            while (running) {
                RequestRecord next;
                try {
                    next = pending.pollFirst(POLL_MILLIS, TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    if (!running) {
                        break;
                    }
                    continue;
                }
                if (next != null) {
                    runGuarded(next);
                }
            }
        } finally {
            workerThread = null;
            // clear a stop() interrupt before the pool reuses this thread
            Thread.interrupted();
            LOG.debug("Queue worker exited");
        }
    }

    private void runGuarded(RequestRecord record) {
        try {
            execute(record);
        } catch (RuntimeException e) {
            LOG.error("Worker failed on request {}", record.id(), e);
            record.tryTransition(RequestStatus.FAILED, "Internal error: " + e.getMessage())
                    .ifPresent(ev -> finish(record, ev));
        }
    }

    private void execute(RequestRecord record) {
        Optional<ProgressEvent> started = record.tryTransition(RequestStatus.RUNNING, null);
        if (started.isEmpty()) {
            // cancelled while queued
            return;
        }
        if (!slot.occupy(record.id())) {
            throw new IllegalStateException("Another request is already running");
        }
        long start = System.nanoTime();
        ThreadContext.put("requestId", record.id());
        try {
            broadcaster.publish(started.get());
            LOG.info("Request {} started", record.id());
            LoopOutcome outcome = loop.run(record.input(), delegates, budget, record::isCancelRequested,
                    turn -> broadcaster.publish(record.appendTurn(turn)));
            RequestStatus terminal = switch (outcome.state()) {
                case FINAL -> RequestStatus.SUCCEEDED;
                case CANCELLED -> RequestStatus.CANCELLED;
                default -> RequestStatus.FAILED;
            };
            String text = outcome.isFinal() ? outcome.text() : outcome.state() + ": " + outcome.text();
            record.tryTransition(terminal, text).ifPresent(e -> finish(record, e));
            metrics.recordRequest(terminal.name().toLowerCase(), System.nanoTime() - start);
            LOG.info("Request {} {} after {} turn(s)", record.id(), terminal, outcome.trace().size());
        } finally {
            slot.release(record.id());
            ThreadContext.remove("requestId");
            // an interrupt aimed at a timed-out delegate must not leak into the next request
            if (running) {
                Thread.interrupted();
            }
        }
    }

    private void finish(RequestRecord record, ProgressEvent terminalEvent) {
        broadcaster.publish(terminalEvent);
        Entry entry = entries.get(record.id());
        if (entry != null) {
            entry.completion().complete(record.snapshot());
        }
        finishedOrder.add(record.id());
        evictFinished();
    }

    private void evictFinished() {
        while (finishedOrder.size() > props.getRetainedRecords()) {
            String oldest = finishedOrder.poll();
            if (oldest == null) {
                return;
            }
            entries.remove(oldest);
            broadcaster.forget(oldest);
        }
    }
}
