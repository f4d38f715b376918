package com.phillippitts.agentcore.service.queue;

import com.phillippitts.agentcore.config.properties.QueueProperties;
import com.phillippitts.agentcore.domain.ProgressEvent;
import com.phillippitts.agentcore.domain.ProgressEventType;
import com.phillippitts.agentcore.domain.RequestInput;
import com.phillippitts.agentcore.domain.RequestSnapshot;
import com.phillippitts.agentcore.domain.RequestStatus;
import com.phillippitts.agentcore.domain.Turn;
import com.phillippitts.agentcore.exception.QueueFullException;
import com.phillippitts.agentcore.exception.RequestNotFoundException;
import com.phillippitts.agentcore.service.agent.LoopBudget;
import com.phillippitts.agentcore.service.agent.ReasoningContext;
import com.phillippitts.agentcore.service.agent.ReasoningLoop;
import com.phillippitts.agentcore.service.delegate.DelegateInvoker;
import com.phillippitts.agentcore.service.delegate.DelegateTable;
import com.phillippitts.agentcore.service.metrics.OrchestrationMetricsPublisher;
import com.phillippitts.agentcore.testutil.EventCapturingPublisher;
import com.phillippitts.agentcore.testutil.ScriptedReasoningBackend;
import com.phillippitts.agentcore.testutil.SyncExecutor;
import com.phillippitts.agentcore.testutil.TestDelegates;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.phillippitts.agentcore.testutil.ScriptedReasoningBackend.answer;
import static com.phillippitts.agentcore.testutil.ScriptedReasoningBackend.call;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class DefaultOrchestrationQueueTest {

    private final ExecutorService worker = Executors.newSingleThreadExecutor();
    private final EventCapturingPublisher publisher = new EventCapturingPublisher();
    private final CountDownLatch release = new CountDownLatch(1);
    private final AtomicInteger active = new AtomicInteger();
    private final AtomicInteger maxActive = new AtomicInteger();
    private final List<String> started = new CopyOnWriteArrayList<>();
    private DefaultOrchestrationQueue queue;

    @AfterEach
    void tearDown() {
        release.countDown();
        if (queue != null) {
            queue.stop();
        }
        worker.shutdownNow();
    }

    /**
     * Answers "done: text". A request whose text is "block" waits for {@link #release};
     * "loop" keeps calling the tick delegate; "ghost" calls a delegate that does not exist.
     */
    private Turn script(ReasoningContext ctx) {
        String text = ctx.input().text();
        if (ctx.iteration() == 1) {
            started.add(text);
        }
        int now = active.incrementAndGet();
        maxActive.accumulateAndGet(now, Math::max);
        try {
            switch (text) {
                case "block" -> {
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return answer("done: block");
                }
                case "loop" -> {
                    return call("tick", Map.of());
                }
                case "ghost" -> {
                    return call("ghost", Map.of());
                }
                default -> {
                    return answer("done: " + text);
                }
            }
        } finally {
            active.decrementAndGet();
        }
    }

    private DefaultOrchestrationQueue newQueue(QueueProperties props) {
        ReasoningLoop loop = new ReasoningLoop(new ScriptedReasoningBackend(this::script),
                new DelegateInvoker(new SyncExecutor(), OrchestrationMetricsPublisher.NOOP));
        DelegateTable table = DelegateTable.of(List.of(TestDelegates.sleeping("tick", 10)));
        queue = new DefaultOrchestrationQueue(loop, table, LoopBudget.of(10_000), props, worker, publisher,
                OrchestrationMetricsPublisher.NOOP);
        queue.start();
        return queue;
    }

    private static RequestSnapshot finished(RequestTicket ticket) throws Exception {
        return ticket.completion().get(5, TimeUnit.SECONDS);
    }

    @Test
    void runsRequestsInSubmissionOrder() throws Exception {
        DefaultOrchestrationQueue q = newQueue(new QueueProperties());

        RequestTicket a = q.submit(RequestInput.of("a"));
        RequestTicket b = q.submit(RequestInput.of("b"));
        RequestTicket c = q.submit(RequestInput.of("c"));

        assertThat(finished(c).status()).isEqualTo(RequestStatus.SUCCEEDED);
        assertThat(finished(a).result()).isEqualTo("done: a");
        assertThat(finished(b).result()).isEqualTo("done: b");
        assertThat(started).containsExactly("a", "b", "c");
    }

    @Test
    void atMostOneRequestRunsAtATime() throws Exception {
        DefaultOrchestrationQueue q = newQueue(new QueueProperties());

        RequestTicket blocker = q.submit(RequestInput.of("block"));
        RequestTicket next = q.submit(RequestInput.of("next"));
        await().atMost(2, TimeUnit.SECONDS).until(() -> q.runningRequestId().isPresent());

        assertThat(q.runningRequestId()).contains(blocker.requestId());
        assertThat(q.snapshot(next.requestId()).status()).isEqualTo(RequestStatus.QUEUED);
        assertThat(q.depth()).isEqualTo(1);

        release.countDown();
        assertThat(finished(next).status()).isEqualTo(RequestStatus.SUCCEEDED);
        assertThat(maxActive.get()).isEqualTo(1);
    }

    @Test
    void cancelledQueuedRequestNeverRuns() throws Exception {
        DefaultOrchestrationQueue q = newQueue(new QueueProperties());
        RequestTicket blocker = q.submit(RequestInput.of("block"));
        RequestTicket victim = q.submit(RequestInput.of("victim"));
        await().atMost(2, TimeUnit.SECONDS).until(() -> q.runningRequestId().isPresent());

        assertThat(q.cancel(victim.requestId())).isTrue();

        RequestSnapshot cancelled = finished(victim);
        assertThat(cancelled.status()).isEqualTo(RequestStatus.CANCELLED);
        assertThat(cancelled.failureReason()).isEqualTo("Cancelled before start");
        assertThat(cancelled.startedAt()).isNull();
        release.countDown();
        finished(blocker);
        assertThat(started).containsExactly("block");
        assertThat(q.cancel(victim.requestId())).isFalse();
    }

    @Test
    void cancellingRunningRequestStopsAtNextTurn() throws Exception {
        DefaultOrchestrationQueue q = newQueue(new QueueProperties());
        RequestTicket looping = q.submit(RequestInput.of("loop"));
        await().atMost(2, TimeUnit.SECONDS).until(() -> q.runningRequestId().isPresent());

        assertThat(q.cancel(looping.requestId())).isTrue();

        RequestSnapshot snapshot = finished(looping);
        assertThat(snapshot.status()).isEqualTo(RequestStatus.CANCELLED);
        assertThat(q.runningRequestId()).isEmpty();
    }

    @Test
    void loopErrorFailsTheRequestWithReason() throws Exception {
        DefaultOrchestrationQueue q = newQueue(new QueueProperties());

        RequestSnapshot snapshot = finished(q.submit(RequestInput.of("ghost")));

        assertThat(snapshot.status()).isEqualTo(RequestStatus.FAILED);
        assertThat(snapshot.failureReason()).startsWith("ERROR: Delegate not found: ghost");
        assertThat(snapshot.result()).isNull();
    }

    @Test
    void lateSubscriberGetsFullHistoryReplayed() throws Exception {
        DefaultOrchestrationQueue q = newQueue(new QueueProperties());
        RequestTicket ticket = q.submit(RequestInput.of("hello"));
        finished(ticket);

        List<ProgressEvent> received = new CopyOnWriteArrayList<>();
        q.subscribe(ticket.requestId(), received::add);

        assertThat(received).extracting(ProgressEvent::type).containsExactly(
                ProgressEventType.QUEUED, ProgressEventType.STARTED, ProgressEventType.TURN,
                ProgressEventType.SUCCEEDED);
        assertThat(received).extracting(ProgressEvent::sequence).containsExactly(1L, 2L, 3L, 4L);
        assertThat(received.get(2).turn().answer()).isEqualTo("done: hello");
        assertThat(publisher.eventsOf(ProgressEvent.class)).hasSize(4);
    }

    @Test
    void subscribersJoiningMidRunSeeEachEventOnceInOrder() throws Exception {
        DefaultOrchestrationQueue q = newQueue(new QueueProperties());
        RequestTicket looping = q.submit(RequestInput.of("loop"));
        await().atMost(2, TimeUnit.SECONDS).until(() -> q.runningRequestId().isPresent());

        List<List<Long>> seen = new CopyOnWriteArrayList<>();
        for (int i = 0; i < 40; i++) {
            List<Long> sequences = new CopyOnWriteArrayList<>();
            seen.add(sequences);
            q.subscribe(looping.requestId(), event -> sequences.add(event.sequence()));
            Thread.sleep(3);
        }
        q.cancel(looping.requestId());
        RequestSnapshot snapshot = finished(looping);

        long last = snapshot.trace().size() + 3L;
        assertThat(snapshot.status()).isEqualTo(RequestStatus.CANCELLED);
        for (List<Long> sequences : seen) {
            assertThat(sequences).isSortedAccordingTo(Long::compare).doesNotHaveDuplicates();
            assertThat(sequences).first().isEqualTo(1L);
            assertThat(sequences).hasSize((int) last).last().isEqualTo(last);
        }
    }

    @Test
    void failingSubscriberDoesNotStopTheWorker() throws Exception {
        DefaultOrchestrationQueue q = newQueue(new QueueProperties());
        q.subscribeAll(event -> {
            throw new IllegalStateException("subscriber broke");
        });

        RequestSnapshot first = finished(q.submit(RequestInput.of("one")));
        RequestSnapshot second = finished(q.submit(RequestInput.of("two")));

        assertThat(first.status()).isEqualTo(RequestStatus.SUCCEEDED);
        assertThat(second.status()).isEqualTo(RequestStatus.SUCCEEDED);
    }

    @Test
    void rejectsSubmissionWhenWaitingCapacityIsReached() {
        DefaultOrchestrationQueue q = newQueue(new QueueProperties(1, 100));
        q.submit(RequestInput.of("block"));
        await().atMost(2, TimeUnit.SECONDS).until(() -> q.runningRequestId().isPresent());
        q.submit(RequestInput.of("waiting"));

        assertThatThrownBy(() -> q.submit(RequestInput.of("overflow")))
                .isInstanceOf(QueueFullException.class)
                .hasMessageContaining("capacity 1");
        assertThat(q.depth()).isEqualTo(1);
    }

    @Test
    void evictsOldestFinishedRecordsBeyondRetention() throws Exception {
        DefaultOrchestrationQueue q = newQueue(new QueueProperties(0, 1));
        RequestTicket first = q.submit(RequestInput.of("first"));
        finished(first);
        RequestTicket second = q.submit(RequestInput.of("second"));
        finished(second);

        assertThat(q.snapshot(second.requestId()).status()).isEqualTo(RequestStatus.SUCCEEDED);
        await().atMost(2, TimeUnit.SECONDS).untilAsserted(() ->
                assertThatThrownBy(() -> q.snapshot(first.requestId())).isInstanceOf(RequestNotFoundException.class));
    }

    @Test
    void unknownRequestIdIsNotFound() {
        DefaultOrchestrationQueue q = newQueue(new QueueProperties());

        assertThatThrownBy(() -> q.snapshot("missing")).isInstanceOf(RequestNotFoundException.class);
        assertThatThrownBy(() -> q.cancel("missing")).isInstanceOf(RequestNotFoundException.class);
    }

    @Test
    void stopCancelsWaitingRequestsAndRejectsNewOnes() throws Exception {
        DefaultOrchestrationQueue q = newQueue(new QueueProperties());
        q.submit(RequestInput.of("block"));
        await().atMost(2, TimeUnit.SECONDS).until(() -> q.runningRequestId().isPresent());
        RequestTicket waiting = q.submit(RequestInput.of("waiting"));

        q.stop();

        RequestSnapshot snapshot = finished(waiting);
        assertThat(snapshot.status()).isEqualTo(RequestStatus.CANCELLED);
        assertThat(snapshot.failureReason()).isEqualTo("Queue stopped");
        assertThatThrownBy(() -> q.submit(RequestInput.of("late"))).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void stopCancelsTheRunningRequestAtItsNextTurn() throws Exception {
        DefaultOrchestrationQueue q = newQueue(new QueueProperties());
        RequestTicket looping = q.submit(RequestInput.of("loop"));
        await().atMost(2, TimeUnit.SECONDS)
                .until(() -> !q.snapshot(looping.requestId()).trace().isEmpty());

        q.stop();

        RequestSnapshot snapshot = finished(looping);
        assertThat(snapshot.status()).isEqualTo(RequestStatus.CANCELLED);
        assertThat(snapshot.failureReason()).startsWith("CANCELLED: Cancelled after");
        assertThat(snapshot.trace().size()).isLessThan(10);
    }
}
