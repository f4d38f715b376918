package com.phillippitts.agentcore.service.pipeline;

import com.phillippitts.agentcore.config.properties.PipelineProperties;
import com.phillippitts.agentcore.domain.PipelineRequest;
import com.phillippitts.agentcore.domain.PipelineResult;
import com.phillippitts.agentcore.domain.PipelineStage;
import com.phillippitts.agentcore.domain.RequestInput;
import com.phillippitts.agentcore.domain.RequestSnapshot;
import com.phillippitts.agentcore.domain.RequestStatus;
import com.phillippitts.agentcore.domain.SynthesisResult;
import com.phillippitts.agentcore.domain.TranscriptionResult;
import com.phillippitts.agentcore.exception.BackendNotReadyException;
import com.phillippitts.agentcore.exception.InvalidAudioException;
import com.phillippitts.agentcore.exception.PipelineStageException;
import com.phillippitts.agentcore.exception.QueueFullException;
import com.phillippitts.agentcore.service.backend.BackendProvider;
import com.phillippitts.agentcore.service.backend.BackendRegistry;
import com.phillippitts.agentcore.service.backend.synthesis.AudioPlayback;
import com.phillippitts.agentcore.service.backend.synthesis.SynthesisProvider;
import com.phillippitts.agentcore.service.backend.synthesis.SynthesisRegistry;
import com.phillippitts.agentcore.service.backend.transcription.TranscriptionProvider;
import com.phillippitts.agentcore.service.backend.transcription.TranscriptionRegistry;
import com.phillippitts.agentcore.service.metrics.OrchestrationMetricsPublisher;
import com.phillippitts.agentcore.service.queue.OrchestrationQueue;
import com.phillippitts.agentcore.service.queue.RequestTicket;
import com.phillippitts.agentcore.service.validation.AudioValidator;
import com.phillippitts.agentcore.util.LogSanitizer;
import com.phillippitts.agentcore.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Default {@link SpeechPipeline}.
 *
 * <p>Backends are looked up fresh from their registry for every run and used for that run
 * only, so a selection change never affects a run in flight. A DEGRADED backend is still used;
 * the run logs a warning and reports {@link PipelineResult#degraded()}. Stage failures never
 * touch registry state.
 *
 * <p>Failures are {@link PipelineStageException}s. They are terminal (retrying the same input
 * will not help) for invalid audio, an empty transcript and unusable backends, and
 * non-terminal for timeouts and backend call errors.
 */
public class DefaultSpeechPipeline implements SpeechPipeline {

    private static final Logger LOG = LogManager.getLogger(DefaultSpeechPipeline.class);

    static final String EMPTY_TRANSCRIPT = "Empty transcription - no audio content detected.";

    private final AudioValidator validator;
    private final TranscriptionRegistry transcription;
    private final SynthesisRegistry synthesis;
    private final OrchestrationQueue queue;
    private final PipelineProperties props;
    private final Executor stageExecutor;
    private final OrchestrationMetricsPublisher metrics;

    public DefaultSpeechPipeline(AudioValidator validator,
                                 TranscriptionRegistry transcription,
                                 SynthesisRegistry synthesis,
                                 OrchestrationQueue queue,
                                 PipelineProperties props,
                                 Executor stageExecutor,
                                 OrchestrationMetricsPublisher metrics) {
        this.validator = Objects.requireNonNull(validator, "validator");
        this.transcription = Objects.requireNonNull(transcription, "transcription");
        this.synthesis = Objects.requireNonNull(synthesis, "synthesis");
        this.queue = Objects.requireNonNull(queue, "queue");
        this.props = Objects.requireNonNull(props, "props");
        this.stageExecutor = Objects.requireNonNull(stageExecutor, "stageExecutor");
        this.metrics = metrics != null ? metrics : OrchestrationMetricsPublisher.NOOP;
    }

    @Override
    public PipelineResult process(PipelineRequest request) {
        Objects.requireNonNull(request, "request");
        long start = System.nanoTime();
        Map<PipelineStage, String> backends = new EnumMap<>(PipelineStage.class);
        boolean degraded = false;

        capture(request.audio());

        BackendRegistry.Selection<TranscriptionProvider> stt = usableSelection(PipelineStage.TRANSCRIPTION, transcription);
        backends.put(PipelineStage.TRANSCRIPTION, stt.id());
        degraded |= stt.isDegraded();
        TranscriptionResult transcript = runStage(PipelineStage.TRANSCRIPTION, props.getTranscriptionTimeoutMs(),
                () -> stt.provider().transcribe(request.audio()));
        if (transcript.isBlank()) {
            recordStage(PipelineStage.TRANSCRIPTION, "empty", 0);
            throw new PipelineStageException(PipelineStage.TRANSCRIPTION, EMPTY_TRANSCRIPT, null, true);
        }
        LOG.debug("Transcript: '{}'", LogSanitizer.preview(transcript.text()));

        ReasoningOutcome reasoning = reason(transcript.text());

        SynthesisResult speech = null;
        if (props.isAutoSpeak() && request.autoSpeak() && !reasoning.response().isBlank()) {
            BackendRegistry.Selection<SynthesisProvider> tts = usableSelection(PipelineStage.SYNTHESIS, synthesis);
            backends.put(PipelineStage.SYNTHESIS, tts.id());
            degraded |= tts.isDegraded();
            speech = runStage(PipelineStage.SYNTHESIS, props.getSynthesisTimeoutMs(),
                    () -> synthesizeAndMaybePlay(tts.provider(), reasoning.response(), request.voice()));
        }

        LOG.info("Pipeline run {} finished in {} ms (stt={}, tts={}, degraded={})", reasoning.requestId(),
                TimeUtils.elapsedMillis(start), backends.get(PipelineStage.TRANSCRIPTION),
                backends.getOrDefault(PipelineStage.SYNTHESIS, "skipped"), degraded);
        return new PipelineResult(reasoning.requestId(), transcript.text(), reasoning.response(), speech,
                backends, degraded);
    }

    private void capture(byte[] audio) {
        long start = System.nanoTime();
        try {
            validator.validate(audio);
            recordStage(PipelineStage.CAPTURE, "success", System.nanoTime() - start);
        } catch (InvalidAudioException e) {
            recordStage(PipelineStage.CAPTURE, "invalid", System.nanoTime() - start);
            throw new PipelineStageException(PipelineStage.CAPTURE, e.getMessage(), e, true);
        }
    }

    private <P extends BackendProvider> BackendRegistry.Selection<P> usableSelection(
            PipelineStage stage, BackendRegistry<P> registry) {
        BackendRegistry.Selection<P> selection;
        try {
            selection = registry.currentSelection();
        } catch (BackendNotReadyException e) {
            recordStage(stage, "not_ready", 0);
            throw new PipelineStageException(stage, e.getMessage(), e, true);
        }
        if (!selection.isUsable()) {
            String reason = registry.failureReason(selection.id()).orElse(String.valueOf(selection.readiness()));
            BackendNotReadyException cause = new BackendNotReadyException(
                    registry.family().key(), selection.id(), reason);
            recordStage(stage, "not_ready", 0);
            throw new PipelineStageException(stage, cause.getMessage(), cause, true);
        }
        if (selection.isDegraded()) {
            LOG.warn("{} stage using DEGRADED backend {}", stage.wireName(), selection.id());
        }
        return selection;
    }

    private ReasoningOutcome reason(String transcript) {
        long start = System.nanoTime();
        RequestTicket ticket;
        try {
            ticket = queue.submit(RequestInput.of(transcript, Map.of("source", "speech")));
        } catch (QueueFullException | IllegalStateException e) {
            recordStage(PipelineStage.REASONING, "rejected", System.nanoTime() - start);
            throw new PipelineStageException(PipelineStage.REASONING, e.getMessage(), e, false);
        }
        RequestSnapshot snapshot;
        try {
            snapshot = ticket.completion().get(props.getReasoningTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            queue.cancel(ticket.requestId());
            recordStage(PipelineStage.REASONING, "timeout", System.nanoTime() - start);
            throw new PipelineStageException(PipelineStage.REASONING,
                    "Timed out after " + props.getReasoningTimeoutMs() + " ms", e, false);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            queue.cancel(ticket.requestId());
            recordStage(PipelineStage.REASONING, "interrupted", System.nanoTime() - start);
            throw new PipelineStageException(PipelineStage.REASONING, "Interrupted", e, false);
        } catch (ExecutionException e) {
            recordStage(PipelineStage.REASONING, "failure", System.nanoTime() - start);
            throw new PipelineStageException(PipelineStage.REASONING, String.valueOf(e.getCause()), e.getCause(), false);
        }
        if (snapshot.status() != RequestStatus.SUCCEEDED) {
            recordStage(PipelineStage.REASONING, "failure", System.nanoTime() - start);
            throw new PipelineStageException(PipelineStage.REASONING,
                    "Request " + snapshot.id() + " " + snapshot.status() + ": " + snapshot.failureReason(),
                    null, false);
        }
        recordStage(PipelineStage.REASONING, "success", System.nanoTime() - start);
        return new ReasoningOutcome(snapshot.id(), snapshot.result() == null ? "" : snapshot.result());
    }

    private SynthesisResult synthesizeAndMaybePlay(SynthesisProvider provider, String text, String voice) {
        SynthesisResult audio = provider.synthesize(text, voice);
        if (props.isPlayLocally() && provider instanceof AudioPlayback playback) {
            playback.play(audio);
        }
        return audio;
    }

    private <T> T runStage(PipelineStage stage, long timeoutMs, Callable<T> work) {
        long start = System.nanoTime();
        FutureTask<T> task = new FutureTask<>(work);
        try {
            stageExecutor.execute(task);
            T result = task.get(timeoutMs, TimeUnit.MILLISECONDS);
            recordStage(stage, "success", System.nanoTime() - start);
            return result;
        } catch (TimeoutException e) {
            task.cancel(true);
            recordStage(stage, "timeout", System.nanoTime() - start);
            throw new PipelineStageException(stage, "Timed out after " + timeoutMs + " ms", e, false);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            recordStage(stage, "failure", System.nanoTime() - start);
            boolean terminal = cause instanceof BackendNotReadyException;
            throw new PipelineStageException(stage, cause == null ? "unknown error" : cause.getMessage(),
                    cause, terminal);
        } catch (InterruptedException e) {
            task.cancel(true);
            Thread.currentThread().interrupt();
            recordStage(stage, "interrupted", System.nanoTime() - start);
            throw new PipelineStageException(stage, "Interrupted", e, false);
        } catch (RejectedExecutionException e) {
            recordStage(stage, "rejected", System.nanoTime() - start);
            throw new PipelineStageException(stage, "Stage executor rejected the call", e, false);
        }
    }

    private void recordStage(PipelineStage stage, String outcome, long nanos) {
        metrics.recordStage(stage.wireName(), outcome, nanos);
    }

    private record ReasoningOutcome(String requestId, String response) {
    }
}
