package com.phillippitts.agentcore.presentation.controller;

import com.phillippitts.agentcore.domain.RequestInput;
import com.phillippitts.agentcore.domain.RequestSnapshot;
import com.phillippitts.agentcore.service.queue.OrchestrationQueue;
import com.phillippitts.agentcore.service.queue.RequestTicket;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Submit, inspect and cancel orchestration requests.
 */
@RestController
@RequestMapping("/api/requests")
class RequestController {

    private static final Logger LOG = LogManager.getLogger(RequestController.class);

    private final OrchestrationQueue queue;

    RequestController(OrchestrationQueue queue) {
        this.queue = queue;
    }

    record SubmitRequest(@NotBlank String text, List<String> mediaRefs, Map<String, String> metadata) {
    }

    @PostMapping
    ResponseEntity<Map<String, Object>> submit(@Valid @RequestBody SubmitRequest body) {
        RequestTicket ticket = queue.submit(new RequestInput(body.text(), body.mediaRefs(), body.metadata()));
        LOG.info("Accepted request {} (queue depth {})", ticket.requestId(), queue.depth());
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(Map.of("requestId", ticket.requestId(), "status", "QUEUED"));
    }

    @GetMapping("/{id}")
    RequestSnapshot snapshot(@PathVariable String id) {
        return queue.snapshot(id);
    }

    @DeleteMapping("/{id}")
    Map<String, Object> cancel(@PathVariable String id) {
        boolean cancelled = queue.cancel(id);
        return Map.of("requestId", id, "cancelled", cancelled);
    }
}
