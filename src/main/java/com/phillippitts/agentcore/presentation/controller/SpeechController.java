package com.phillippitts.agentcore.presentation.controller;

import com.phillippitts.agentcore.domain.PipelineRequest;
import com.phillippitts.agentcore.domain.PipelineResult;
import com.phillippitts.agentcore.domain.PipelineStage;
import com.phillippitts.agentcore.service.pipeline.SpeechPipeline;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs captured audio through the speech pipeline. The request body is WAV or raw PCM16LE mono 16 kHz.
 */
@RestController
class SpeechController {

    private final SpeechPipeline pipeline;

    SpeechController(SpeechPipeline pipeline) {
        this.pipeline = pipeline;
    }

    @PostMapping(path = "/api/speech",
            consumes = {"audio/wav", "audio/x-wav", MediaType.APPLICATION_OCTET_STREAM_VALUE})
    Map<String, Object> process(@RequestBody byte[] audio,
                                @RequestParam(required = false) String voice,
                                @RequestParam(defaultValue = "true") boolean autoSpeak) {
        PipelineResult result = pipeline.process(new PipelineRequest(audio, voice, autoSpeak));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("requestId", result.requestId());
        body.put("transcript", result.transcript());
        body.put("response", result.response());
        Map<String, String> backends = new LinkedHashMap<>();
        for (PipelineStage stage : PipelineStage.values()) {
            String id = result.backends().get(stage);
            if (id != null) {
                backends.put(stage.wireName(), id);
            }
        }
        body.put("backends", backends);
        body.put("degraded", result.degraded());
        if (result.speech() != null) {
            body.put("speechMediaType", result.speech().mediaType());
            body.put("speech", Base64.getEncoder().encodeToString(result.speech().audio()));
        }
        return body;
    }
}
