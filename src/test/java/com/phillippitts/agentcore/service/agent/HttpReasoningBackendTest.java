package com.phillippitts.agentcore.service.agent;

import com.phillippitts.agentcore.config.properties.ReasoningHttpProperties;
import com.phillippitts.agentcore.domain.RequestInput;
import com.phillippitts.agentcore.domain.Turn;
import com.phillippitts.agentcore.domain.TurnAction;
import com.phillippitts.agentcore.exception.MalformedTurnException;
import com.phillippitts.agentcore.exception.ReasoningBackendException;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.time.Clock;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HttpReasoningBackendTest {

    private static final String ENDPOINT = "http://llm.test/v1/chat/completions";

    private MockRestServiceServer server;
    private HttpReasoningBackend backend;
    private final ReasoningContext context = new ReasoningContext(RequestInput.of("what is six times seven"), "",
            List.of(), 1, 5, Map.of("calculator", "Evaluates arithmetic"));

    @BeforeEach
    void setUp() {
        ReasoningHttpProperties props = new ReasoningHttpProperties();
        props.setModel("test-model");
        props.setTemperature(0.0);
        RestClient.Builder builder = RestClient.builder().baseUrl("http://llm.test/v1");
        server = MockRestServiceServer.bindTo(builder).build();
        backend = new HttpReasoningBackend(builder.build(), props, new PromptRenderer("Be brief.", Clock.systemUTC()));
    }

    private static String reply(String content) {
        return new JSONObject()
                .put("choices", List.of(Map.of("message", Map.of("role", "assistant", "content", content))))
                .toString();
    }

    @Test
    void postsRenderedPromptAndParsesTurn() {
        server.expect(requestTo(ENDPOINT))
                .andExpect(method(HttpMethod.POST))
                .andExpect(jsonPath("$.model").value("test-model"))
                .andExpect(jsonPath("$.messages[0].role").value("system"))
                .andExpect(jsonPath("$.messages[1].role").value("user"))
                .andRespond(withSuccess(reply("""
                        {"observation": "needs math", "plan": ["multiply"], "action": "tool",
                         "response": {"delegate": "calculator", "args": {"expression": "6*7"}}}
                        """), MediaType.APPLICATION_JSON));

        Turn turn = backend.complete(context);

        assertThat(turn.action()).isEqualTo(TurnAction.TOOL);
        assertThat(turn.delegateCall().delegateName()).isEqualTo("calculator");
        assertThat(turn.delegateCall().arguments()).containsEntry("expression", "6*7");
        server.verify();
    }

    @Test
    void requestBodyCarriesBothMessages() {
        JSONObject body = backend.requestBody(context);

        assertThat(body.getJSONArray("messages").getJSONObject(0).getString("content"))
                .contains("Be brief.")
                .contains("- calculator: Evaluates arithmetic");
        assertThat(body.getJSONArray("messages").getJSONObject(1).getString("content"))
                .contains("what is six times seven");
    }

    @Test
    void httpErrorBecomesReasoningBackendException() {
        server.expect(requestTo(ENDPOINT)).andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

        assertThatThrownBy(() -> backend.complete(context))
                .isInstanceOf(ReasoningBackendException.class)
                .hasMessageContaining("Chat completion request failed");
    }

    @Test
    void unparseableContentIsMalformedTurn() {
        server.expect(requestTo(ENDPOINT))
                .andRespond(withSuccess(reply("I think the answer is 42"), MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> backend.complete(context)).isInstanceOf(MalformedTurnException.class);
    }

    @Test
    void responseWithoutChoicesIsRejected() {
        assertThatThrownBy(() -> HttpReasoningBackend.extractContent("{\"choices\": []}"))
                .isInstanceOf(ReasoningBackendException.class)
                .hasMessageContaining("no choices");
        assertThatThrownBy(() -> HttpReasoningBackend.extractContent("{\"error\": \"quota\"}"))
                .isInstanceOf(ReasoningBackendException.class)
                .hasMessageContaining("Unexpected chat completion response");
        assertThatThrownBy(() -> HttpReasoningBackend.extractContent(""))
                .isInstanceOf(ReasoningBackendException.class);
    }
}
