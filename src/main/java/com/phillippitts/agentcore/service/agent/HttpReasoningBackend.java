package com.phillippitts.agentcore.service.agent;

import com.phillippitts.agentcore.config.properties.ReasoningHttpProperties;
import com.phillippitts.agentcore.domain.Turn;
import com.phillippitts.agentcore.exception.ReasoningBackendException;
import com.phillippitts.agentcore.util.LogSanitizer;
import com.phillippitts.agentcore.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Objects;

/**
 * {@link ReasoningBackend} over an OpenAI-compatible {@code /chat/completions} endpoint.
 *
 * <p>The context is rendered by {@link PromptRenderer}; the first choice's message content is
 * parsed by {@link TurnParser}. Transport and HTTP errors become {@link ReasoningBackendException}.
 */
public class HttpReasoningBackend implements ReasoningBackend {

    private static final Logger LOG = LogManager.getLogger(HttpReasoningBackend.class);
    private static final String CHAT_COMPLETIONS_PATH = "/chat/completions";

    private final RestClient restClient;
    private final ReasoningHttpProperties props;
    private final PromptRenderer renderer;

    public HttpReasoningBackend(ReasoningHttpProperties props, PromptRenderer renderer) {
        this(buildClient(props), props, renderer);
    }

    HttpReasoningBackend(RestClient restClient, ReasoningHttpProperties props, PromptRenderer renderer) {
        this.restClient = Objects.requireNonNull(restClient, "restClient");
        this.props = Objects.requireNonNull(props, "props");
        this.renderer = Objects.requireNonNull(renderer, "renderer");
    }

    private static RestClient buildClient(ReasoningHttpProperties props) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(props.getTimeoutMs());
        factory.setReadTimeout(props.getTimeoutMs());
        RestClient.Builder builder = RestClient.builder()
                .baseUrl(props.getBaseUrl())
                .requestFactory(factory)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        if (props.getApiKey() != null && !props.getApiKey().isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + props.getApiKey());
        }
        return builder.build();
    }

    @Override
    public Turn complete(ReasoningContext context) {
        String body = requestBody(context).toString();
        long start = System.nanoTime();
        String reply;
        try {
            reply = restClient.post()
                    .uri(CHAT_COMPLETIONS_PATH)
                    .body(body)
                    .retrieve()
                    .body(String.class);
        } catch (RestClientException e) {
            throw new ReasoningBackendException("Chat completion request failed: " + e.getMessage(), e);
        }
        String content = extractContent(reply);
        LOG.debug("Chat completion (iteration {}) in {} ms: '{}'", context.iteration(),
                TimeUtils.elapsedMillis(start), LogSanitizer.preview(content));
        return TurnParser.parse(content);
    }

    JSONObject requestBody(ReasoningContext context) {
        JSONArray messages = new JSONArray()
                .put(new JSONObject().put("role", "system").put("content", renderer.systemMessage(context)))
                .put(new JSONObject().put("role", "user").put("content", renderer.userMessage(context)));
        return new JSONObject()
                .put("model", props.getModel())
                .put("temperature", props.getTemperature())
                .put("messages", messages);
    }

    static String extractContent(String reply) {
        if (reply == null || reply.isBlank()) {
            throw new ReasoningBackendException("Empty chat completion response");
        }
        try {
            JSONArray choices = new JSONObject(reply).getJSONArray("choices");
            if (choices.isEmpty()) {
                throw new ReasoningBackendException("Chat completion returned no choices");
            }
            return choices.getJSONObject(0).getJSONObject("message").optString("content", "");
        } catch (JSONException e) {
            throw new ReasoningBackendException("Unexpected chat completion response: " + e.getMessage(), e);
        }
    }
}
