package com.fuelcopilot.behavior.metrics;

import com.fuelcopilot.behavior.model.BehaviorEvent;
import com.fuelcopilot.behavior.state.VehicleStateStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Service for managing driver behavior metrics
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BehaviorMetricsService {

    public static final String SKIP_REASON_GAP = "gap";
    public static final String SKIP_REASON_DUPLICATE = "duplicate";

    private final MeterRegistry meterRegistry;
    private final VehicleStateStore stateStore;

    private Counter samplesProcessedCounter;
    private Counter dailyResetCounter;
    private Counter evictedVehiclesCounter;
    private Counter evictionFailureCounter;

    @PostConstruct
    public void initMetrics() {
        samplesProcessedCounter = Counter.builder("behavior.samples.processed")
                .description("Telemetry samples run through the behavior detectors")
                .register(meterRegistry);

        dailyResetCounter = Counter.builder("behavior.daily.resets")
                .description("UTC day transitions that zeroed the scoring accumulators")
                .register(meterRegistry);

        evictedVehiclesCounter = Counter.builder("behavior.vehicles.evicted")
                .description("Vehicle records removed by the eviction sweep")
                .register(meterRegistry);

        evictionFailureCounter = Counter.builder("behavior.eviction.failures")
                .description("Eviction sweeps that failed")
                .register(meterRegistry);

        Gauge.builder("behavior.vehicles.tracked", stateStore, VehicleStateStore::size)
                .description("Vehicles with in-memory behavior state")
                .register(meterRegistry);
    }

    public void recordSampleProcessed() {
        samplesProcessedCounter.increment();
    }

    /**
     * Record a sample that refreshed last values but skipped detection
     */
    public void recordSampleSkipped(String reason) {
        Counter.builder("behavior.samples.skipped")
                .description("Telemetry samples skipped by the gap policy")
                .tag("reason", reason)
                .register(meterRegistry)
                .increment();
    }

    public void recordEvents(List<BehaviorEvent> events) {
        for (BehaviorEvent event : events) {
            Counter.builder("behavior.events.detected")
                    .description("Behavior events emitted")
                    .tag("type", event.getBehaviorType().name())
                    .tag("severity", event.getSeverity().name())
                    .register(meterRegistry)
                    .increment();
        }
    }

    public void recordDailyReset() {
        dailyResetCounter.increment();
    }

    public void recordEviction(int removed) {
        evictedVehiclesCounter.increment(removed);
        log.debug("Recorded eviction: removed={}", removed);
    }

    public void recordEvictionFailure() {
        evictionFailureCounter.increment();
    }

    public Timer.Sample startProcessingTimer() {
        return Timer.start(meterRegistry);
    }

    public void stopProcessingTimer(Timer.Sample sample, String operation) {
        sample.stop(Timer.builder("behavior.processing.duration")
                .description("Time taken by behavior engine operations")
                .tag("operation", operation)
                .register(meterRegistry));
    }
}
