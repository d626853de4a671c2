package com.missionguard;

import com.missionguard.config.EngineProperties;
import com.missionguard.config.PerformanceConfiguration.EngineMetrics;
import com.missionguard.domain.model.IntLane;
import com.missionguard.domain.model.Mission;
import com.missionguard.domain.model.ObservationWindow;
import com.missionguard.infrastructure.audit.AuditEvent;
import com.missionguard.infrastructure.audit.AuditService;
import com.missionguard.infrastructure.policy.PolicyConfigurationLoader;
import com.missionguard.infrastructure.policy.PolicyRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.core.io.DefaultResourceLoader;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Shared builders for unit tests.
 */
public final class TestFixtures {

    public static final Instant WINDOW_START = Instant.parse("2025-03-01T00:00:00Z");

    private TestFixtures() {}

    public static EngineProperties properties() {
        return new EngineProperties();
    }

    public static PolicyRegistry defaultRegistry() {
        return loader(properties()).load();
    }

    public static PolicyConfigurationLoader loader(EngineProperties properties) {
        return new PolicyConfigurationLoader(new DefaultResourceLoader(), properties);
    }

    public static EngineMetrics metrics() {
        return new EngineMetrics(new SimpleMeterRegistry());
    }

    public static Instant day(int day) {
        return WINDOW_START.plus(day - 1L, ChronoUnit.DAYS);
    }

    public static Mission.MissionBuilder mission(String id, String authorityId, IntLane... lanes) {
        return Mission.builder()
            .id(id)
            .name("Mission " + id)
            .authorityId(authorityId)
            .intLanesPresent(Set.of(lanes))
            .observationWindow(ObservationWindow.builder()
                .start(WINDOW_START)
                .end(day(11))
                .build());
    }

    /** Collects audit events in memory. */
    public static final class RecordingAuditService implements AuditService {

        private final List<AuditEvent> events = new CopyOnWriteArrayList<>();

        @Override
        public void record(AuditEvent event) {
            events.add(event);
        }

        public List<AuditEvent> events() {
            return events;
        }

        public List<AuditEvent> ofType(String type) {
            return events.stream().filter(e -> type.equals(e.getType())).toList();
        }
    }
}
