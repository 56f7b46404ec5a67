package com.fuelcopilot.behavior.metrics;

import com.fuelcopilot.behavior.config.BehaviorThresholds;
import com.fuelcopilot.behavior.model.BehaviorEvent;
import com.fuelcopilot.behavior.model.BehaviorType;
import com.fuelcopilot.behavior.model.SeverityLevel;
import com.fuelcopilot.behavior.state.VehicleStateStore;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("BehaviorMetricsService Tests")
class BehaviorMetricsServiceTest {

    private SimpleMeterRegistry registry;
    private VehicleStateStore store;
    private BehaviorMetricsService metricsService;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        store = new VehicleStateStore(BehaviorThresholds.defaults(), Clock.systemUTC());
        metricsService = new BehaviorMetricsService(registry, store);
        metricsService.initMetrics();
    }

    @Test
    @DisplayName("Should count events by type and severity")
    void shouldTagEvents() {
        metricsService.recordEvents(List.of(
                event(BehaviorType.HARD_BRAKING, SeverityLevel.MINOR),
                event(BehaviorType.HARD_BRAKING, SeverityLevel.MINOR),
                event(BehaviorType.OVERSPEEDING, SeverityLevel.SEVERE)));

        assertThat(registry.get("behavior.events.detected")
                .tag("type", "HARD_BRAKING").tag("severity", "MINOR").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("behavior.events.detected")
                .tag("type", "OVERSPEEDING").counter().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Tracked-vehicle gauge should follow the store")
    void gaugeShouldFollowStore() {
        store.getOrCreate("TRK-1");
        store.getOrCreate("TRK-2");

        assertThat(registry.get("behavior.vehicles.tracked").gauge().value()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Should time engine operations per operation tag")
    void shouldTimeOperations() {
        Timer.Sample sample = metricsService.startProcessingTimer();
        metricsService.stopProcessingTimer(sample, "process");

        assertThat(registry.get("behavior.processing.duration").tag("operation", "process").timer().count())
                .isEqualTo(1L);
    }

    @Test
    @DisplayName("Should accumulate evictions and failures")
    void shouldCountEvictions() {
        metricsService.recordEviction(3);
        metricsService.recordEviction(0);
        metricsService.recordEvictionFailure();

        assertThat(registry.get("behavior.vehicles.evicted").counter().count()).isEqualTo(3.0);
        assertThat(registry.get("behavior.eviction.failures").counter().count()).isEqualTo(1.0);
    }

    private static BehaviorEvent event(BehaviorType type, SeverityLevel severity) {
        return BehaviorEvent.builder()
                .vehicleId("TRK-1")
                .timestamp(Instant.parse("2025-06-15T10:00:00Z"))
                .behaviorType(type)
                .severity(severity)
                .build();
    }
}
