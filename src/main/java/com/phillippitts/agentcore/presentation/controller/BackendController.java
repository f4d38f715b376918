package com.phillippitts.agentcore.presentation.controller;

import com.phillippitts.agentcore.domain.BackendFamily;
import com.phillippitts.agentcore.domain.BackendReadiness;
import com.phillippitts.agentcore.domain.BackendStatus;
import com.phillippitts.agentcore.service.backend.BackendRegistry;
import com.phillippitts.agentcore.service.backend.synthesis.SynthesisRegistry;
import com.phillippitts.agentcore.service.backend.transcription.TranscriptionRegistry;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Health, selection and re-initialization of transcription and synthesis backends.
 */
@RestController
@RequestMapping("/api/backends/{family}")
class BackendController {

    private static final Logger LOG = LogManager.getLogger(BackendController.class);

    private final TranscriptionRegistry transcriptionRegistry;
    private final SynthesisRegistry synthesisRegistry;

    BackendController(TranscriptionRegistry transcriptionRegistry, SynthesisRegistry synthesisRegistry) {
        this.transcriptionRegistry = transcriptionRegistry;
        this.synthesisRegistry = synthesisRegistry;
    }

    record SelectionRequest(@NotBlank String id) {
    }

    @GetMapping
    List<BackendStatus> health(@PathVariable String family) {
        return registry(family).health();
    }

    @PutMapping("/selection")
    Map<String, Object> select(@PathVariable String family, @Valid @RequestBody SelectionRequest body) {
        BackendRegistry<?> registry = registry(family);
        registry.select(body.id());
        LOG.info("Selected {} backend {}", registry.family().key(), body.id());
        return Map.of("family", registry.family().key(), "selected", body.id());
    }

    @PostMapping("/{id}/reinitialize")
    CompletableFuture<Map<String, Object>> reinitialize(@PathVariable String family, @PathVariable String id) {
        BackendRegistry<?> registry = registry(family);
        return registry.reinitialize(id)
                .thenApply(readiness -> result(registry, id, readiness));
    }

    private static Map<String, Object> result(BackendRegistry<?> registry, String id, BackendReadiness readiness) {
        return registry.failureReason(id)
                .<Map<String, Object>>map(reason -> Map.of("id", id, "readiness", readiness, "reason", reason))
                .orElseGet(() -> Map.of("id", id, "readiness", readiness));
    }

    private BackendRegistry<?> registry(String family) {
        return switch (BackendFamily.fromKey(family)) {
            case TRANSCRIPTION -> transcriptionRegistry;
            case SYNTHESIS -> synthesisRegistry;
        };
    }
}
