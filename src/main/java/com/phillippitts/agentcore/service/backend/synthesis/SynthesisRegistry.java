package com.phillippitts.agentcore.service.backend.synthesis;

import com.phillippitts.agentcore.domain.BackendFamily;
import com.phillippitts.agentcore.service.backend.BackendRegistry;
import com.phillippitts.agentcore.service.metrics.OrchestrationMetricsPublisher;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.util.concurrent.Executor;

/** Registry of {@link SynthesisProvider}s. */
public class SynthesisRegistry extends BackendRegistry<SynthesisProvider> {

    public SynthesisRegistry(Settings settings,
                             Executor initExecutor,
                             ApplicationEventPublisher publisher,
                             OrchestrationMetricsPublisher metrics,
                             Clock clock) {
        super(BackendFamily.SYNTHESIS, settings, initExecutor, publisher, metrics, clock);
    }
}
