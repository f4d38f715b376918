package com.phillippitts.agentcore.service.agent;

import com.phillippitts.agentcore.domain.Turn;
import org.json.JSONArray;
import org.json.JSONObject;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.Map;
import java.util.Objects;

/**
 * Renders a {@link ReasoningContext} into the system and user messages of a chat completion.
 */
public class PromptRenderer {

    static final String RESPONSE_FORMAT = """
            ## RESPONSE FORMAT

            Respond with a single JSON object and nothing else:
            - observation (string): what you learned from the latest result
            - plan (list of strings): the next steps
            - action (string): "tool" to call a delegate, "answer" to finish
            - response: for "tool", {"delegate": "<name>", "args": {...}}; for "answer", the final answer text
            """;

    private final String instructions;
    private final Clock clock;

    public PromptRenderer(String instructions, Clock clock) {
        this.instructions = instructions == null ? "" : instructions.strip();
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public String systemMessage(ReasoningContext ctx) {
        StringBuilder sb = new StringBuilder();
        if (!instructions.isEmpty()) {
            sb.append(instructions).append("\n\n");
        }
        sb.append("## CONTEXT\n")
                .append("Current time: ").append(ZonedDateTime.now(clock)).append('\n')
                .append("Iteration ").append(ctx.iteration()).append(" of ").append(ctx.maxIterations())
                .append("\n\n");
        sb.append("## DELEGATES\n");
        if (ctx.delegates().isEmpty()) {
            sb.append("(none; answer directly)\n");
        }
        for (Map.Entry<String, String> d : ctx.delegates().entrySet()) {
            sb.append("- ").append(d.getKey()).append(": ").append(d.getValue()).append('\n');
        }
        sb.append('\n').append(RESPONSE_FORMAT);
        return sb.toString();
    }

    public String userMessage(ReasoningContext ctx) {
        StringBuilder sb = new StringBuilder();
        if (!ctx.trace().isEmpty()) {
            sb.append("## HISTORY\n");
            int i = 1;
            for (Turn turn : ctx.trace()) {
                sb.append(i++).append(". ").append(renderTurn(turn)).append('\n');
            }
            sb.append('\n');
        }
        sb.append("## CURRENT REQUEST\n\n").append(ctx.input().text());
        if (ctx.iteration() > 1) {
            sb.append("\n\n## LATEST RESULT\n\n").append(ctx.observation());
        }
        return sb.toString();
    }

    private static String renderTurn(Turn turn) {
        JSONObject obj = new JSONObject();
        obj.put("plan", new JSONArray(turn.plan()));
        obj.put("action", turn.action().name().toLowerCase());
        if (turn.isAnswer()) {
            obj.put("response", turn.answer());
        } else {
            obj.put("response", new JSONObject()
                    .put("delegate", turn.delegateCall().delegateName())
                    .put("args", new JSONObject(turn.delegateCall().arguments())));
        }
        return "observed: " + turn.observation() + " -> " + obj;
    }
}
