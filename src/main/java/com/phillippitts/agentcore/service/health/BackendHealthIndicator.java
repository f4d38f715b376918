package com.phillippitts.agentcore.service.health;

import com.phillippitts.agentcore.domain.BackendReadiness;
import com.phillippitts.agentcore.domain.BackendStatus;
import com.phillippitts.agentcore.service.backend.BackendRegistry;
import com.phillippitts.agentcore.service.backend.synthesis.SynthesisRegistry;
import com.phillippitts.agentcore.service.backend.transcription.TranscriptionRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Health indicator for the backend registries.
 *
 * <ul>
 *   <li>UP: the selected provider of every family is READY</li>
 *   <li>DEGRADED: every family has a usable selection, at least one of them DEGRADED</li>
 *   <li>DOWN: some family has no usable selection</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health.
 */
@Component
public class BackendHealthIndicator implements HealthIndicator {

    private final List<BackendRegistry<?>> registries;

    public BackendHealthIndicator(TranscriptionRegistry transcriptionRegistry,
                                  SynthesisRegistry synthesisRegistry) {
        this.registries = List.of(transcriptionRegistry, synthesisRegistry);
    }

    @Override
    public Health health() {
        boolean allReady = true;
        boolean allUsable = true;
        Health.Builder builder = new Health.Builder();

        for (BackendRegistry<?> registry : registries) {
            List<BackendStatus> statuses = registry.health();
            BackendReadiness selected = statuses.stream()
                    .filter(BackendStatus::selected)
                    .map(BackendStatus::readiness)
                    .findFirst()
                    .orElse(BackendReadiness.UNREGISTERED);
            allReady &= selected == BackendReadiness.READY;
            allUsable &= selected.isUsable();
            builder.withDetail(registry.family().key(), describe(statuses));
        }

        if (allReady) {
            builder.up();
        } else if (allUsable) {
            builder.status("DEGRADED");
        } else {
            builder.down();
        }
        return builder.build();
    }

    private Map<String, Object> describe(List<BackendStatus> statuses) {
        Map<String, Object> detail = new LinkedHashMap<>();
        for (BackendStatus status : statuses) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("readiness", status.readiness().name());
            entry.put("selected", status.selected());
            if (status.failureReason() != null) {
                entry.put("reason", status.failureReason());
            } else if (status.lastProbe() != null && !status.lastProbe().ready()) {
                entry.put("reason", status.lastProbe().reason());
                if (status.lastProbe().remediation() != null) {
                    entry.put("remediation", status.lastProbe().remediation());
                }
            }
            detail.put(status.id(), entry);
        }
        return detail;
    }
}
