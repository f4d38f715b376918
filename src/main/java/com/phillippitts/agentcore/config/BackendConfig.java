package com.phillippitts.agentcore.config;

import com.phillippitts.agentcore.config.properties.BackendProperties;
import com.phillippitts.agentcore.config.properties.PiperProperties;
import com.phillippitts.agentcore.config.properties.WhisperCppProperties;
import com.phillippitts.agentcore.service.backend.asset.AssetFetcher;
import com.phillippitts.agentcore.service.backend.asset.HttpAssetFetcher;
import com.phillippitts.agentcore.service.backend.process.ProcessRunner;
import com.phillippitts.agentcore.service.backend.synthesis.SynthesisProvider;
import com.phillippitts.agentcore.service.backend.synthesis.SynthesisRegistry;
import com.phillippitts.agentcore.service.backend.synthesis.piper.PiperSynthesisProvider;
import com.phillippitts.agentcore.service.backend.transcription.TranscriptionProvider;
import com.phillippitts.agentcore.service.backend.transcription.TranscriptionRegistry;
import com.phillippitts.agentcore.service.backend.transcription.whisper.WhisperCppTranscriptionProvider;
import com.phillippitts.agentcore.service.metrics.OrchestrationMetricsPublisher;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * Backend registries and the bundled local providers.
 *
 * <p>Every {@link TranscriptionProvider} and {@link SynthesisProvider} bean is registered in its
 * family's registry in bean order; initialization starts after the application is ready
 * (see {@link com.phillippitts.agentcore.service.lifecycle.BackendLifecycleManager}).
 */
@Configuration
public class BackendConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ProcessRunner processRunner() {
        return new ProcessRunner();
    }

    @Bean
    public AssetFetcher assetFetcher() {
        return new HttpAssetFetcher();
    }

    @Bean
    @ConditionalOnProperty(prefix = "backend.whisper-cpp", name = "enabled", havingValue = "true", matchIfMissing = true)
    public WhisperCppTranscriptionProvider whisperCppTranscriptionProvider(WhisperCppProperties props,
                                                                           ProcessRunner runner,
                                                                           AssetFetcher assetFetcher) {
        return new WhisperCppTranscriptionProvider(props, runner, assetFetcher);
    }

    @Bean
    @ConditionalOnProperty(prefix = "backend.piper", name = "enabled", havingValue = "true", matchIfMissing = true)
    public PiperSynthesisProvider piperSynthesisProvider(PiperProperties props,
                                                         ProcessRunner runner,
                                                         AssetFetcher assetFetcher) {
        return new PiperSynthesisProvider(props, runner, assetFetcher);
    }

    @Bean
    public TranscriptionRegistry transcriptionRegistry(BackendProperties props,
                                                       ObjectProvider<TranscriptionProvider> providers,
                                                       @Qualifier("backendInitExecutor") Executor initExecutor,
                                                       ApplicationEventPublisher publisher,
                                                       OrchestrationMetricsPublisher metrics,
                                                       Clock clock) {
        TranscriptionRegistry registry = new TranscriptionRegistry(props.settingsFor(props.getTranscription()),
                initExecutor, publisher, metrics, clock);
        providers.orderedStream().forEach(registry::register);
        return registry;
    }

    @Bean
    public SynthesisRegistry synthesisRegistry(BackendProperties props,
                                               ObjectProvider<SynthesisProvider> providers,
                                               @Qualifier("backendInitExecutor") Executor initExecutor,
                                               ApplicationEventPublisher publisher,
                                               OrchestrationMetricsPublisher metrics,
                                               Clock clock) {
        SynthesisRegistry registry = new SynthesisRegistry(props.settingsFor(props.getSynthesis()),
                initExecutor, publisher, metrics, clock);
        providers.orderedStream().forEach(registry::register);
        return registry;
    }
}
