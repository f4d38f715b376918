package com.phillippitts.agentcore.service.lifecycle;

import com.phillippitts.agentcore.domain.BackendStatus;
import com.phillippitts.agentcore.service.backend.BackendRegistry;
import com.phillippitts.agentcore.service.backend.synthesis.SynthesisRegistry;
import com.phillippitts.agentcore.service.backend.transcription.TranscriptionRegistry;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Drives registry lifecycle: initialization once the application is ready, periodic health
 * refresh, and provider shutdown.
 *
 * <p>Initialization runs on the backend-init pool, so startup and request intake never wait
 * for model downloads or readiness checks.
 */
@Component
public class BackendLifecycleManager {

    private static final Logger LOG = LogManager.getLogger(BackendLifecycleManager.class);

    private final List<BackendRegistry<?>> registries;

    public BackendLifecycleManager(TranscriptionRegistry transcriptionRegistry,
                                   SynthesisRegistry synthesisRegistry) {
        this.registries = List.of(transcriptionRegistry, synthesisRegistry);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void initializeBackends() {
        for (BackendRegistry<?> registry : registries) {
            LOG.info("Initializing {} backends: {}", registry.family().key(), registry.ids());
            registry.initializeAll().whenComplete((ignored, error) -> {
                if (error != null) {
                    LOG.error("{} backend initialization did not complete", registry.family().key(), error);
                } else {
                    logSummary(registry);
                }
            });
        }
    }

    @Scheduled(fixedDelayString = "${backend.health-refresh-ms:60000}",
               initialDelayString = "${backend.health-refresh-ms:60000}")
    public void refreshHealth() {
        for (BackendRegistry<?> registry : registries) {
            try {
                logSummary(registry);
            } catch (RuntimeException e) {
                LOG.warn("Health refresh failed for {} registry: {}", registry.family().key(), e.toString());
            }
        }
    }

    @PreDestroy
    public void shutdown() {
        registries.forEach(BackendRegistry::close);
    }

    private void logSummary(BackendRegistry<?> registry) {
        List<BackendStatus> statuses = registry.health();
        String summary = statuses.stream()
                .map(s -> s.id() + "=" + s.readiness() + (s.selected() ? "*" : ""))
                .collect(Collectors.joining(", "));
        LOG.info("{} backends: [{}]", registry.family().key(), summary);
    }
}
