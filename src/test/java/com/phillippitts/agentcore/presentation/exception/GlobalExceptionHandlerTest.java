package com.phillippitts.agentcore.presentation.exception;

import com.phillippitts.agentcore.domain.PipelineStage;
import com.phillippitts.agentcore.exception.BackendNotReadyException;
import com.phillippitts.agentcore.exception.BackendOperationException;
import com.phillippitts.agentcore.exception.InvalidAudioException;
import com.phillippitts.agentcore.exception.ModelNotFoundException;
import com.phillippitts.agentcore.exception.PipelineStageException;
import com.phillippitts.agentcore.exception.QueueFullException;
import com.phillippitts.agentcore.exception.RequestNotFoundException;
import com.phillippitts.agentcore.exception.UnknownBackendException;
import com.phillippitts.agentcore.presentation.exception.GlobalExceptionHandler.ApiError;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void unknownBackendAndRequestAreNotFound() {
        assertThat(handler.handleUnknownBackend(new UnknownBackendException("transcription", "vosk"))
                .getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(handler.handleRequestNotFound(new RequestNotFoundException("r-1"))
                .getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void queueFullAsksClientToRetry() {
        ResponseEntity<ApiError> response = handler.handleQueueFull(new QueueFullException(8));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.TOO_MANY_REQUESTS);
        assertThat(response.getBody().errorCode()).isEqualTo("QueueFullException");
        assertThat(response.getBody().details()).isEqualTo("Please retry later");
    }

    @Test
    void backendNotReadyIsServiceUnavailable() {
        ResponseEntity<ApiError> response = handler.handleNotReady(
                new BackendNotReadyException("synthesis", "piper", "voice missing"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().message()).isEqualTo("synthesis backend unavailable");
        assertThat(response.getBody().details()).isEqualTo("voice missing");
    }

    @Test
    void modelNotFoundDoesNotExposeFilePath() {
        ResponseEntity<ApiError> response = handler.handleModelNotFound(
                new ModelNotFoundException("/secret/internal/path/model.bin"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().toString()).doesNotContain("/secret/internal/path");
        assertThat(response.getBody().details()).contains("Model not loaded");
        assertThat(response.getBody().timestamp()).isNotNull();
    }

    @Test
    void captureStageKeepsBadRequest() {
        InvalidAudioException cause = new InvalidAudioException(10, "Audio too short");
        PipelineStageException ex = new PipelineStageException(PipelineStage.CAPTURE, cause.getMessage(), cause, true);

        ResponseEntity<ApiError> response = handler.handlePipelineStage(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().errorCode()).isEqualTo("InvalidAudioException");
    }

    @Test
    void retryableStageFailureIsBadGatewayWithRetryHint() {
        PipelineStageException ex = new PipelineStageException(PipelineStage.TRANSCRIPTION,
                "Timed out after 100 ms", null, false);

        ResponseEntity<ApiError> response = handler.handlePipelineStage(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
        assertThat(response.getBody().message()).isEqualTo("transcription stage failed");
        assertThat(response.getBody().details()).isEqualTo("Please retry in a few seconds");
    }

    @Test
    void stageWithUnreadyBackendIsServiceUnavailable() {
        BackendNotReadyException cause = new BackendNotReadyException("synthesis", "piper", "FAILED");
        PipelineStageException ex = new PipelineStageException(PipelineStage.SYNTHESIS, cause.getMessage(), cause, true);

        ResponseEntity<ApiError> response = handler.handlePipelineStage(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().details()).contains("piper");
    }

    @Test
    void illegalArgumentAndStateMapToClientAndAvailabilityErrors() {
        assertThat(handler.handleIllegalArgument(new IllegalArgumentException("Unknown backend family: x"))
                .getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(handler.handleIllegalState(new IllegalStateException("Orchestration queue is not running"))
                .getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    }

    @Test
    void otherApplicationErrorsHideDetails() {
        ResponseEntity<ApiError> response = handler.handleAgentCore(
                new BackendOperationException("Synthesis failed: exit 1", "piper"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().details()).doesNotContain("exit 1");
    }

    @Test
    void unexpectedErrorIsInternalServerError() {
        ResponseEntity<ApiError> response = handler.handleUnexpected(new RuntimeException("boom"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().errorCode()).isEqualTo("InternalServerError");
        assertThat(response.getBody().toString()).doesNotContain("boom");
    }
}
