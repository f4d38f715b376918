package com.phillippitts.agentcore;

import com.jayway.jsonpath.JsonPath;
import com.phillippitts.agentcore.domain.Turn;
import com.phillippitts.agentcore.service.agent.ReasoningBackend;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Boots the whole application with both process backends disabled and a mocked reasoning backend.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class AgentCoreApplicationTests {

    @Autowired
    private MockMvc mvc;

    @MockBean
    private ReasoningBackend reasoningBackend;

    @BeforeEach
    void setUp() {
        given(reasoningBackend.complete(any())).willReturn(Turn.answer("", List.of(), "42"));
    }

    @Test
    void contextLoads() {
    }

    @Test
    void submittedRequestRunsToCompletion() throws Exception {
        MvcResult accepted = mvc.perform(post("/api/requests")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"what is six times seven\"}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.status").value("QUEUED"))
                .andReturn();
        String id = JsonPath.read(accepted.getResponse().getContentAsString(), "$.requestId");

        await().atMost(5, TimeUnit.SECONDS).untilAsserted(() ->
                mvc.perform(get("/api/requests/{id}", id))
                        .andExpect(status().isOk())
                        .andExpect(jsonPath("$.status").value("SUCCEEDED"))
                        .andExpect(jsonPath("$.result").value("42")));

        mvc.perform(delete("/api/requests/{id}", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cancelled").value(false));
    }

    @Test
    void blankTextIsRejected() throws Exception {
        mvc.perform(post("/api/requests")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("ValidationError"));
    }

    @Test
    void unknownRequestIsNotFound() throws Exception {
        mvc.perform(get("/api/requests/{id}", "no-such-request"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("RequestNotFoundException"));
    }

    @Test
    void backendEndpointsValidateFamilyAndId() throws Exception {
        mvc.perform(get("/api/backends/transcription"))
                .andExpect(status().isOk())
                .andExpect(content().json("[]"));
        mvc.perform(get("/api/backends/vision"))
                .andExpect(status().isBadRequest());
        mvc.perform(put("/api/backends/synthesis/selection")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\":\"piper\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("UnknownBackendException"));
    }

    @Test
    void speechWithTooShortAudioIsBadRequest() throws Exception {
        mvc.perform(post("/api/speech")
                        .contentType(MediaType.APPLICATION_OCTET_STREAM)
                        .content(new byte[64]))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("InvalidAudioException"));
    }
}
