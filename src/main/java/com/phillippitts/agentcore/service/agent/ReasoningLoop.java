package com.phillippitts.agentcore.service.agent;

import com.phillippitts.agentcore.domain.DelegateCall;
import com.phillippitts.agentcore.domain.DelegateResult;
import com.phillippitts.agentcore.domain.LoopOutcome;
import com.phillippitts.agentcore.domain.RequestInput;
import com.phillippitts.agentcore.domain.Turn;
import com.phillippitts.agentcore.exception.DelegateNotFoundException;
import com.phillippitts.agentcore.exception.MalformedTurnException;
import com.phillippitts.agentcore.service.delegate.Delegate;
import com.phillippitts.agentcore.service.delegate.DelegateInvoker;
import com.phillippitts.agentcore.service.delegate.DelegateTable;
import com.phillippitts.agentcore.util.LogSanitizer;
import com.phillippitts.agentcore.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;

/**
 * Observe → plan → act loop over a {@link ReasoningBackend} and a {@link DelegateTable}.
 *
 * <p>Each iteration asks the backend for one {@link Turn}. An answer ends the run with
 * {@code FINAL}. A tool request is dispatched by name exactly once; its result, or its failure
 * text, becomes the observation of the next iteration. The run ends with:
 * <ul>
 *   <li>{@code ERROR} for an unknown delegate, a malformed turn or a backend failure,</li>
 *   <li>{@code BUDGET_EXCEEDED} when the iteration or wall-clock budget runs out,</li>
 *   <li>{@code CANCELLED} when cancellation is observed at a turn boundary.</li>
 * </ul>
 *
 * <p>The loop holds no per-run state, so one instance serves the queue worker and every nested
 * {@link com.phillippitts.agentcore.service.delegate.AgentDelegate}.
 */
public class ReasoningLoop {

    private static final Logger LOG = LogManager.getLogger(ReasoningLoop.class);

    private final ReasoningBackend backend;
    private final DelegateInvoker invoker;
    private final Executor reasoningExecutor;

    public ReasoningLoop(ReasoningBackend backend, DelegateInvoker invoker) {
        this(backend, invoker, null);
    }

    /**
     * @param reasoningExecutor runs backend calls when a reasoning timeout is configured; when
     *                          null the timeout is not enforced
     */
    public ReasoningLoop(ReasoningBackend backend, DelegateInvoker invoker, Executor reasoningExecutor) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.invoker = Objects.requireNonNull(invoker, "invoker");
        this.reasoningExecutor = reasoningExecutor;
    }

    public LoopOutcome run(RequestInput input, DelegateTable delegates, LoopBudget budget) {
        return run(input, delegates, budget, () -> false, LoopListener.NONE);
    }

    public LoopOutcome run(RequestInput input,
                           DelegateTable delegates,
                           LoopBudget budget,
                           BooleanSupplier cancelled,
                           LoopListener listener) {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(delegates, "delegates");
        Objects.requireNonNull(budget, "budget");
        BooleanSupplier isCancelled = cancelled != null ? cancelled : () -> false;
        LoopListener onTurn = listener != null ? listener : LoopListener.NONE;

        long start = System.nanoTime();
        long deadline = TimeUtils.deadlineAfter(budget.wallClock());
        List<Turn> trace = new ArrayList<>();
        String observation = input.text();
        LOG.debug("Loop started: maxIterations={}, delegates={}, input='{}'",
                budget.maxIterations(), delegates.names(), LogSanitizer.preview(input.text()));

        for (int iteration = 1; iteration <= budget.maxIterations(); iteration++) {
            if (isCancelled.getAsBoolean()) {
                return finish(LoopOutcome.cancelled("Cancelled after " + trace.size() + " turn(s)", trace), start);
            }
            if (TimeUtils.isExpired(deadline)) {
                return finish(LoopOutcome.budgetExceeded("Wall-clock budget of " + budget.wallClock().toMillis()
                        + " ms exceeded after " + trace.size() + " turn(s)", trace), start);
            }

            ReasoningContext context = new ReasoningContext(input, observation, trace, iteration,
                    budget.maxIterations(), delegates.descriptions());
            Turn turn;
            try {
                turn = nextTurn(context, budget.reasoningTimeout());
            } catch (MalformedTurnException e) {
                return finish(LoopOutcome.error("Malformed turn: " + e.getMessage(), trace), start);
            } catch (RuntimeException e) {
                return finish(LoopOutcome.error("Reasoning backend failed: " + describe(e), trace), start);
            }

            turn = turn.withObservation(observation);
            trace.add(turn);
            notifyListener(onTurn, turn);

            if (turn.isAnswer()) {
                return finish(LoopOutcome.finalAnswer(turn.answer(), trace), start);
            }

            DelegateCall call = turn.delegateCall();
            Optional<Delegate> delegate = delegates.find(call.delegateName());
            if (delegate.isEmpty()) {
                String reason = new DelegateNotFoundException(call.delegateName(), delegates.names()).getMessage();
                return finish(LoopOutcome.error(reason, trace), start);
            }
            DelegateResult result = invoker.invoke(delegate.get(), call.arguments(),
                    delegateTimeout(budget, deadline));
            observation = result.toObservation();
        }
        if (isCancelled.getAsBoolean()) {
            return finish(LoopOutcome.cancelled("Cancelled after " + trace.size() + " turn(s)", trace), start);
        }
        return finish(LoopOutcome.budgetExceeded("Reached max iterations (" + budget.maxIterations()
                + ") without a final answer", trace), start);
    }

    private Turn nextTurn(ReasoningContext context, Duration timeout) {
        if (reasoningExecutor == null || timeout.isZero() || timeout.isNegative()) {
            return Objects.requireNonNull(backend.complete(context), "reasoning backend returned null");
        }
        FutureTask<Turn> task = new FutureTask<>(() -> backend.complete(context));
        try {
            reasoningExecutor.execute(task);
            return Objects.requireNonNull(task.get(timeout.toMillis(), TimeUnit.MILLISECONDS),
                    "reasoning backend returned null");
        } catch (TimeoutException e) {
            task.cancel(true);
            throw new IllegalStateException("timed out after " + timeout.toMillis() + " ms", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw new IllegalStateException(describe(e.getCause()), e.getCause());
        } catch (InterruptedException e) {
            task.cancel(true);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted", e);
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("reasoning executor rejected the call", e);
        }
    }

    // The delegate never gets more time than the wall-clock budget has left.
    private static Duration delegateTimeout(LoopBudget budget, long deadline) {
        long remaining = TimeUtils.remainingMillis(deadline);
        Duration configured = budget.delegateTimeout();
        if (remaining == Long.MAX_VALUE) {
            return configured;
        }
        Duration left = Duration.ofMillis(Math.max(1, remaining));
        return configured.isZero() || left.compareTo(configured) < 0 ? left : configured;
    }

    private static void notifyListener(LoopListener listener, Turn turn) {
        try {
            listener.onTurn(turn);
        } catch (RuntimeException e) {
            LOG.warn("Turn listener failed: {}", e.toString());
        }
    }

    private static LoopOutcome finish(LoopOutcome outcome, long start) {
        long ms = TimeUtils.elapsedMillis(start);
        if (outcome.isFinal()) {
            LOG.debug("Loop finished FINAL after {} turn(s) in {} ms", outcome.trace().size(), ms);
        } else {
            LOG.info("Loop finished {} after {} turn(s) in {} ms: {}", outcome.state(),
                    outcome.trace().size(), ms, outcome.text());
        }
        return outcome;
    }

    private static String describe(Throwable t) {
        if (t == null) {
            return "unknown error";
        }
        String msg = t.getMessage();
        return msg == null || msg.isBlank() ? t.getClass().getSimpleName() : msg;
    }
}
