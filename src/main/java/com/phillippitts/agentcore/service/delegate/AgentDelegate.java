package com.phillippitts.agentcore.service.delegate;

import com.phillippitts.agentcore.domain.LoopOutcome;
import com.phillippitts.agentcore.domain.RequestInput;
import com.phillippitts.agentcore.exception.DelegateFailureException;
import com.phillippitts.agentcore.service.agent.LoopBudget;
import com.phillippitts.agentcore.service.agent.LoopListener;
import com.phillippitts.agentcore.service.agent.ReasoningLoop;
import com.phillippitts.agentcore.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;
import java.util.Objects;

/**
 * A sub-agent exposed as a delegate: runs a nested {@link ReasoningLoop} over its own delegate
 * table and budget, taking {@code {"query": "..."}}.
 *
 * <p>A {@code FINAL} outcome is returned as the delegate's text. Any other outcome is a
 * {@link DelegateFailureException} whose code is the nested terminal state in lower case
 * ({@code error}, {@code budget_exceeded}, {@code cancelled}). Interrupting the calling thread,
 * as the invoker does on timeout, cancels the nested run at its next turn boundary.
 */
public class AgentDelegate implements Delegate {

    private static final Logger LOG = LogManager.getLogger(AgentDelegate.class);

    private final String name;
    private final String description;
    private final ReasoningLoop loop;
    private final DelegateTable delegates;
    private final LoopBudget budget;

    public AgentDelegate(String name, String description, ReasoningLoop loop,
                         DelegateTable delegates, LoopBudget budget) {
        this.name = Objects.requireNonNull(name, "name");
        this.description = description == null ? "" : description;
        this.loop = Objects.requireNonNull(loop, "loop");
        this.delegates = Objects.requireNonNull(delegates, "delegates");
        this.budget = Objects.requireNonNull(budget, "budget");
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String description() {
        return description + " Arguments: {\"query\": \"<task for this agent>\"}";
    }

    @Override
    public String invoke(Map<String, Object> arguments) {
        Object query = arguments.get("query");
        if (query == null || String.valueOf(query).isBlank()) {
            throw new DelegateFailureException("invalid_arguments", name + " requires a non-blank \"query\"");
        }
        Thread caller = Thread.currentThread();
        LOG.debug("Sub-agent {} started: '{}'", name, LogSanitizer.preview(String.valueOf(query)));
        LoopOutcome outcome = loop.run(RequestInput.of(String.valueOf(query)), delegates, budget,
                caller::isInterrupted, LoopListener.NONE);
        if (outcome.isFinal()) {
            return outcome.text();
        }
        throw new DelegateFailureException(outcome.state().name().toLowerCase(),
                name + " ended " + outcome.state() + ": " + outcome.text());
    }
}
