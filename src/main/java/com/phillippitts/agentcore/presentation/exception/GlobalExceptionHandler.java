package com.phillippitts.agentcore.presentation.exception;

import com.phillippitts.agentcore.exception.AgentCoreException;
import com.phillippitts.agentcore.exception.BackendNotReadyException;
import com.phillippitts.agentcore.exception.DuplicateBackendException;
import com.phillippitts.agentcore.exception.InvalidAudioException;
import com.phillippitts.agentcore.exception.ModelNotFoundException;
import com.phillippitts.agentcore.exception.PipelineStageException;
import com.phillippitts.agentcore.exception.QueueFullException;
import com.phillippitts.agentcore.exception.RequestNotFoundException;
import com.phillippitts.agentcore.exception.UnknownBackendException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while protecting sensitive details from clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(UnknownBackendException.class)
    ResponseEntity<ApiError> handleUnknownBackend(UnknownBackendException ex) {
        LOG.debug("Unknown backend: family={}, id={}", ex.getFamily(), ex.getBackendId());
        return error(HttpStatus.NOT_FOUND, ex, "Unknown backend", ex.getMessage());
    }

    @ExceptionHandler(RequestNotFoundException.class)
    ResponseEntity<ApiError> handleRequestNotFound(RequestNotFoundException ex) {
        LOG.debug("Request not found: {}", ex.getRequestId());
        return error(HttpStatus.NOT_FOUND, ex, "Request not found", ex.getMessage());
    }

    @ExceptionHandler(DuplicateBackendException.class)
    ResponseEntity<ApiError> handleDuplicate(DuplicateBackendException ex) {
        LOG.warn("Duplicate backend id: {}", ex.getBackendId());
        return error(HttpStatus.CONFLICT, ex, "Duplicate backend", ex.getMessage());
    }

    /**
     * Back-pressure: the client should retry later (HTTP 429).
     */
    @ExceptionHandler(QueueFullException.class)
    ResponseEntity<ApiError> handleQueueFull(QueueFullException ex) {
        LOG.warn("Rejected request: queue full (capacity={})", ex.getCapacity());
        return error(HttpStatus.TOO_MANY_REQUESTS, ex, "Orchestration queue is full", "Please retry later");
    }

    @ExceptionHandler(BackendNotReadyException.class)
    ResponseEntity<ApiError> handleNotReady(BackendNotReadyException ex) {
        LOG.warn("Backend not ready: family={}, id={}, reason={}", ex.getFamily(), ex.getBackendId(), ex.getReason());
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex, ex.getFamily() + " backend unavailable", ex.getReason());
    }

    /**
     * Configuration/setup error surfaced at runtime. The model path is not exposed to clients.
     */
    @ExceptionHandler(ModelNotFoundException.class)
    ResponseEntity<ApiError> handleModelNotFound(ModelNotFoundException ex) {
        LOG.error("Model not found at path: {}", ex.getModelPath());
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex, "Backend unavailable",
                "Model not loaded. Contact administrator.");
    }

    /**
     * Client error - invalid input (HTTP 400).
     */
    @ExceptionHandler(InvalidAudioException.class)
    ResponseEntity<ApiError> handleInvalidAudio(InvalidAudioException ex) {
        LOG.warn("Invalid audio: size={}, reason={}", ex.getAudioSize(), ex.getReason());
        return error(HttpStatus.BAD_REQUEST, ex, "Invalid audio format", ex.getMessage());
    }

    /**
     * Stage failures are upstream problems (502), unless a backend was not ready (503).
     * Invalid audio keeps its 400.
     */
    @ExceptionHandler(PipelineStageException.class)
    ResponseEntity<ApiError> handlePipelineStage(PipelineStageException ex) {
        if (ex.getCause() instanceof InvalidAudioException invalid) {
            return handleInvalidAudio(invalid);
        }
        HttpStatus status = ex.getCause() instanceof BackendNotReadyException
                ? HttpStatus.SERVICE_UNAVAILABLE
                : HttpStatus.BAD_GATEWAY;
        LOG.warn("Pipeline stage {} failed (terminal={}): {}", ex.getStage().wireName(), ex.isTerminal(),
                ex.getMessage());
        return error(status, ex, ex.getStage().wireName() + " stage failed",
                ex.isTerminal() ? ex.getMessage() : "Please retry in a few seconds");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(f -> f.getField() + " " + f.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return ResponseEntity.badRequest()
                .body(new ApiError("ValidationError", "Invalid request", details, Instant.now()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException ex) {
        return ResponseEntity.badRequest()
                .body(new ApiError("BadRequest", "Invalid request", ex.getMessage(), Instant.now()));
    }

    /**
     * Queue stopped during shutdown (HTTP 503).
     */
    @ExceptionHandler(IllegalStateException.class)
    ResponseEntity<ApiError> handleIllegalState(IllegalStateException ex) {
        LOG.warn("Service unavailable: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(new ApiError("ServiceUnavailable", "Service unavailable", ex.getMessage(), Instant.now()));
    }

    @ExceptionHandler(AgentCoreException.class)
    ResponseEntity<ApiError> handleAgentCore(AgentCoreException ex) {
        LOG.error("Unhandled application error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, ex, "Request failed", "Please contact support with request ID");
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, Exception ex, String message, String details) {
        return ResponseEntity.status(status)
                .body(new ApiError(ex.getClass().getSimpleName(), message, details, Instant.now()));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
