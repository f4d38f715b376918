package com.phillippitts.agentcore.service.agent;

import com.phillippitts.agentcore.domain.Turn;
import com.phillippitts.agentcore.domain.TurnAction;
import com.phillippitts.agentcore.exception.MalformedTurnException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class TurnParserTest {

    @Test
    void parsesAnswerTurn() {
        Turn turn = TurnParser.parse("""
                {"observation": "user greeted", "plan": ["reply"], "action": "answer", "response": "Hello!"}
                """);

        assertThat(turn.action()).isEqualTo(TurnAction.ANSWER);
        assertThat(turn.answer()).isEqualTo("Hello!");
        assertThat(turn.plan()).containsExactly("reply");
        assertThat(turn.observation()).isEqualTo("user greeted");
    }

    @Test
    void parsesStructuredToolCall() {
        Turn turn = TurnParser.parse("""
                {"action": "tool", "response": {"delegate": "search", "args": {"query": "weather", "limit": 3}}}
                """);

        assertThat(turn.action()).isEqualTo(TurnAction.TOOL);
        assertThat(turn.delegateCall().delegateName()).isEqualTo("search");
        assertThat(turn.delegateCall().arguments()).containsEntry("query", "weather").containsEntry("limit", 3);
    }

    @Test
    void parsesCallFormWithJsonArguments() {
        Turn turn = TurnParser.parse("{\"action\": \"tool\", \"response\": \"speak({\\\"text\\\": \\\"hi\\\"})\"}");

        assertThat(turn.delegateCall().delegateName()).isEqualTo("speak");
        assertThat(turn.delegateCall().arguments()).containsExactly(entry("text", "hi"));
    }

    @Test
    void nonJsonArgumentsBecomeQuery() {
        Turn turn = TurnParser.parse("{\"action\": \"tool\", \"response\": \"search('latest news')\"}");

        assertThat(turn.delegateCall().arguments()).containsExactly(entry("query", "latest news"));
    }

    @Test
    void bareNameIsCallWithoutArguments() {
        Turn turn = TurnParser.parse("{\"action\": \"tool\", \"response\": \"clock\"}");

        assertThat(turn.delegateCall().delegateName()).isEqualTo("clock");
        assertThat(turn.delegateCall().arguments()).isEmpty();
    }

    @Test
    void ignoresTextAroundTheJsonObject() {
        Turn turn = TurnParser.parse("""
                Sure! Here is my answer:
                ```json
                {"action": "answer", "response": "use {braces} freely"}
                ```
                """);

        assertThat(turn.answer()).isEqualTo("use {braces} freely");
    }

    @Test
    void planMayBeAPlainString() {
        Turn turn = TurnParser.parse("{\"plan\": \"look it up\", \"action\": \"answer\", \"response\": \"ok\"}");

        assertThat(turn.plan()).containsExactly("look it up");
    }

    @Test
    void rejectsReplyWithoutJson() {
        assertThatThrownBy(() -> TurnParser.parse("I think the answer is 4"))
                .isInstanceOf(MalformedTurnException.class)
                .hasMessageContaining("No JSON object");
    }

    @Test
    void rejectsUnknownAction() {
        assertThatThrownBy(() -> TurnParser.parse("{\"action\": \"dance\", \"response\": \"x\"}"))
                .isInstanceOf(MalformedTurnException.class)
                .hasMessageContaining("unknown action");
    }

    @Test
    void rejectsToolCallWithoutDelegateName() {
        assertThatThrownBy(() -> TurnParser.parse("{\"action\": \"tool\", \"response\": {\"args\": {}}}"))
                .isInstanceOf(MalformedTurnException.class)
                .hasMessageContaining("without delegate name");
    }

    @Test
    void extractJsonObjectHonoursStringLiterals() {
        assertThat(TurnParser.extractJsonObject("x {\"a\": \"}\"} y")).isEqualTo("{\"a\": \"}\"}");
        assertThat(TurnParser.extractJsonObject("no braces")).isNull();
    }
}
