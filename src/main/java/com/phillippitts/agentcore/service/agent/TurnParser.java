package com.phillippitts.agentcore.service.agent;

import com.phillippitts.agentcore.domain.DelegateCall;
import com.phillippitts.agentcore.domain.Turn;
import com.phillippitts.agentcore.domain.TurnAction;
import com.phillippitts.agentcore.exception.MalformedTurnException;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a {@link Turn} from model output.
 *
 * <p>The reply must contain a JSON object with {@code action} ({@code tool} or {@code answer})
 * and {@code response}; {@code observation} and {@code plan} are optional. Text around the
 * object (markdown fences, chatter) is ignored. A tool response is either
 * <pre>
 *   {"delegate": "search", "args": {"query": "..."}}
 * </pre>
 * or the call form {@code search({"query": "..."})}. Arguments that are not a JSON object are
 * passed as {@code {"query": raw}}.
 */
public final class TurnParser {

    private static final Pattern CALL_FORM = Pattern.compile("^\\s*(\\w+)\\s*\\((.*)\\)\\s*$", Pattern.DOTALL);
    private static final Pattern BARE_NAME = Pattern.compile("^\\s*(\\w+)\\s*$");

    private TurnParser() {
    }

    /**
     * @throws MalformedTurnException if no JSON object is present or required fields are missing
     */
    public static Turn parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new MalformedTurnException("Empty reasoning reply", raw);
        }
        String json = extractJsonObject(raw);
        if (json == null) {
            throw new MalformedTurnException("No JSON object in reasoning reply", raw);
        }
        JSONObject obj;
        try {
            obj = new JSONObject(json);
        } catch (JSONException e) {
            throw new MalformedTurnException("Invalid JSON: " + e.getMessage(), raw, e);
        }

        TurnAction action = TurnAction.fromWire(obj.optString("action", null));
        if (action == null) {
            throw new MalformedTurnException("Missing or unknown action: " + obj.opt("action"), raw);
        }
        String observation = obj.optString("observation", "");
        List<String> plan = readPlan(obj.opt("plan"));
        Object response = obj.opt("response");

        if (action == TurnAction.ANSWER) {
            if (response == null || response == JSONObject.NULL) {
                throw new MalformedTurnException("Answer turn without response", raw);
            }
            return Turn.answer(observation, plan, String.valueOf(response));
        }
        return Turn.tool(observation, plan, readCall(response, raw));
    }

    private static DelegateCall readCall(Object response, String raw) {
        if (response instanceof JSONObject call) {
            String name = firstString(call, "delegate", "name", "tool");
            if (name == null || name.isBlank()) {
                throw new MalformedTurnException("Tool response without delegate name", raw);
            }
            Object args = call.opt("args");
            if (args == null) {
                args = call.opt("arguments");
            }
            return DelegateCall.of(name, readArguments(args));
        }
        if (response instanceof String text) {
            Matcher m = CALL_FORM.matcher(text);
            if (m.matches()) {
                return DelegateCall.of(m.group(1), readArguments(m.group(2).trim()));
            }
            Matcher bare = BARE_NAME.matcher(text);
            if (bare.matches()) {
                return DelegateCall.of(bare.group(1), Map.of());
            }
        }
        throw new MalformedTurnException("Unrecognized tool response: " + response, raw);
    }

    private static Map<String, Object> readArguments(Object args) {
        if (args == null || args == JSONObject.NULL) {
            return Map.of();
        }
        if (args instanceof JSONObject obj) {
            return new LinkedHashMap<>(obj.toMap());
        }
        String text = String.valueOf(args).trim();
        if (text.isEmpty()) {
            return Map.of();
        }
        if (text.startsWith("{")) {
            Map<String, Object> parsed = tryParseObject(text);
            if (parsed != null) {
                return parsed;
            }
        }
        Map<String, Object> query = new LinkedHashMap<>();
        query.put("query", unquote(text));
        return query;
    }

    private static Map<String, Object> tryParseObject(String text) {
        try {
            return new LinkedHashMap<>(new JSONObject(text).toMap());
        } catch (JSONException e) {
            return null;
        }
    }

    private static List<String> readPlan(Object plan) {
        List<String> steps = new ArrayList<>();
        if (plan instanceof JSONArray array) {
            for (int i = 0; i < array.length(); i++) {
                String step = array.optString(i, "").trim();
                if (!step.isEmpty()) {
                    steps.add(step);
                }
            }
        } else if (plan instanceof String text && !text.isBlank()) {
            steps.add(text.trim());
        }
        return steps;
    }

    private static String firstString(JSONObject obj, String... keys) {
        for (String key : keys) {
            String value = obj.optString(key, null);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static String unquote(String s) {
        if (s.length() >= 2 && s.charAt(0) == s.charAt(s.length() - 1)
                && (s.charAt(0) == '"' || s.charAt(0) == '\'')) {
            return s.substring(1, s.length() - 1);
        }
        return s;
    }

    /**
     * Returns the first balanced {@code {...}} block, honouring string literals, or null.
     */
    static String extractJsonObject(String raw) {
        int start = raw.indexOf('{');
        while (start >= 0) {
            int depth = 0;
            boolean inString = false;
            boolean escaped = false;
            for (int i = start; i < raw.length(); i++) {
                char c = raw.charAt(i);
                if (inString) {
                    if (escaped) {
                        escaped = false;
                    } else if (c == '\\') {
                        escaped = true;
                    } else if (c == '"') {
                        inString = false;
                    }
                } else if (c == '"') {
                    inString = true;
                } else if (c == '{') {
                    depth++;
                } else if (c == '}') {
                    depth--;
                    if (depth == 0) {
                        return raw.substring(start, i + 1);
                    }
                }
            }
            start = raw.indexOf('{', start + 1);
        }
        return null;
    }
}
