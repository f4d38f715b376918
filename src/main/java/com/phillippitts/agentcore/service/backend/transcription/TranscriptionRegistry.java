package com.phillippitts.agentcore.service.backend.transcription;

import com.phillippitts.agentcore.domain.BackendFamily;
import com.phillippitts.agentcore.service.backend.BackendRegistry;
import com.phillippitts.agentcore.service.metrics.OrchestrationMetricsPublisher;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.util.concurrent.Executor;

/** Registry of {@link TranscriptionProvider}s. */
public class TranscriptionRegistry extends BackendRegistry<TranscriptionProvider> {

    public TranscriptionRegistry(Settings settings,
                                 Executor initExecutor,
                                 ApplicationEventPublisher publisher,
                                 OrchestrationMetricsPublisher metrics,
                                 Clock clock) {
        super(BackendFamily.TRANSCRIPTION, settings, initExecutor, publisher, metrics, clock);
    }
}
