package com.fuelcopilot.behavior.engine;

import com.fuelcopilot.behavior.coaching.CoachingTipService;
import com.fuelcopilot.behavior.config.BehaviorThresholds;
import com.fuelcopilot.behavior.config.properties.BehaviorProperties;
import com.fuelcopilot.behavior.detection.BehaviorDetector;
import com.fuelcopilot.behavior.detection.DetectionContext;
import com.fuelcopilot.behavior.exception.InvalidTelemetryException;
import com.fuelcopilot.behavior.fleet.FleetBehaviorAggregator;
import com.fuelcopilot.behavior.metrics.BehaviorMetricsService;
import com.fuelcopilot.behavior.model.BehaviorEvent;
import com.fuelcopilot.behavior.model.CoachingTip;
import com.fuelcopilot.behavior.model.FleetBehaviorSummary;
import com.fuelcopilot.behavior.model.HeavyFootScore;
import com.fuelcopilot.behavior.model.MpgCrossValidation;
import com.fuelcopilot.behavior.model.TelemetrySample;
import com.fuelcopilot.behavior.scoring.HeavyFootScorer;
import com.fuelcopilot.behavior.state.VehicleBehaviorState;
import com.fuelcopilot.behavior.state.VehicleStateSnapshot;
import com.fuelcopilot.behavior.state.VehicleStateStore;
import com.fuelcopilot.behavior.validation.MpgCrossValidator;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Driver behavior engine
 *
 * <p>Entry point for telemetry ingestion and every pull-based query. Samples
 * for one vehicle are processed under that vehicle's lock; different vehicles
 * proceed in parallel.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DriverBehaviorEngine {

    private final VehicleStateStore stateStore;
    private final List<BehaviorDetector> detectors;
    private final BehaviorThresholds thresholds;
    private final BehaviorProperties properties;
    private final HeavyFootScorer scorer;
    private final MpgCrossValidator crossValidator;
    private final FleetBehaviorAggregator fleetAggregator;
    private final CoachingTipService coachingTipService;
    private final BehaviorMetricsService metricsService;

    // UTC day of the most recent sample that triggered a reset; shared by all vehicles
    private final AtomicReference<LocalDate> currentScoringDay = new AtomicReference<>();

    /**
     * Process one telemetry sample and return the behavior events it triggered.
     *
     * <p>Samples that arrive too soon after the previous one (including
     * out-of-order samples) or after a long gap only refresh the vehicle's last
     * reading; no detector runs and no events are returned.
     *
     * @throws InvalidTelemetryException if the vehicle id is blank or the sample has no timestamp
     */
    public List<BehaviorEvent> process(String vehicleId, TelemetrySample sample) {
        validate(vehicleId, sample);
        Timer.Sample timer = metricsService.startProcessingTimer();
        try {
            rollScoringDay(sample.getTimestamp());
            List<BehaviorEvent> events = stateStore.withVehicle(vehicleId, state -> processLocked(state, sample));
            metricsService.recordEvents(events);
            return events;
        } finally {
            metricsService.stopProcessingTimer(timer, "process");
        }
    }

    /**
     * Heavy-foot score for the current scoring day, using the configured period.
     */
    public Optional<HeavyFootScore> calculateHeavyFootScore(String vehicleId) {
        return calculateHeavyFootScore(vehicleId, properties.getFleet().getScoringPeriodHours(), null);
    }

    /**
     * @param drivingHours hours actually driven, or null to estimate from the period
     * @return empty for a vehicle that has never reported
     */
    public Optional<HeavyFootScore> calculateHeavyFootScore(String vehicleId, double periodHours, Double drivingHours) {
        if (periodHours <= 0) {
            throw new InvalidTelemetryException("Scoring period must be positive, got " + periodHours);
        }
        return stateStore.snapshot(vehicleId)
                .map(snapshot -> scorer.score(snapshot, periodHours, drivingHours));
    }

    public Optional<MpgCrossValidation> crossValidateMpg(String vehicleId) {
        return stateStore.snapshot(vehicleId).flatMap(crossValidator::validate);
    }

    public Optional<FleetBehaviorSummary> fleetSummary() {
        Timer.Sample timer = metricsService.startProcessingTimer();
        try {
            return fleetAggregator.summarize();
        } finally {
            metricsService.stopProcessingTimer(timer, "fleet_summary");
        }
    }

    public List<CoachingTip> coachingTips(String vehicleId) {
        return calculateHeavyFootScore(vehicleId)
                .map(score -> coachingTipService.tipsFor(score, properties.getFleet().getMaxCoachingTips()))
                .orElse(List.of());
    }

    /**
     * Events detected for the vehicle since the last daily reset, oldest first.
     */
    public List<BehaviorEvent> recentEvents(String vehicleId) {
        return stateStore.snapshot(vehicleId)
                .map(VehicleStateSnapshot::getEvents)
                .orElse(List.of());
    }

    /**
     * Drop state for vehicles that left the fleet or stopped reporting.
     *
     * @return number of vehicles removed
     */
    public int evictInactive(Set<String> activeVehicleIds, Duration maxInactive) {
        int removed = stateStore.evict(activeVehicleIds, maxInactive);
        if (removed > 0) {
            log.info("Evicted {} inactive vehicles, {} still tracked", removed, stateStore.size());
        }
        metricsService.recordEviction(removed);
        return removed;
    }

    public Optional<LocalDate> currentScoringDay() {
        return Optional.ofNullable(currentScoringDay.get());
    }

    private List<BehaviorEvent> processLocked(VehicleBehaviorState state, TelemetrySample sample) {
        applyDailyReset(state);

        Instant timestamp = sample.getTimestamp();
        double dtSeconds = 0.0;
        Instant lastTimestamp = state.getLastTimestamp();
        if (lastTimestamp != null) {
            dtSeconds = Duration.between(lastTimestamp, timestamp).toMillis() / 1000.0;
            String skipReason = skipReason(dtSeconds);
            if (skipReason != null) {
                log.debug("Skipping detection for {}: dt={}s ({})", state.getVehicleId(), dtSeconds, skipReason);
                state.recordLastValues(sample.getSpeed(), sample.getRpm(), sample.getGear(), timestamp);
                metricsService.recordSampleSkipped(skipReason);
                return List.of();
            }
        }

        DetectionContext context = DetectionContext.builder()
                .vehicleId(state.getVehicleId())
                .sample(sample)
                .state(state)
                .thresholds(thresholds)
                .dtSeconds(dtSeconds)
                .build();
        for (BehaviorDetector detector : detectors) {
            detector.detect(context);
        }

        captureMpg(state, sample);
        state.recordLastValues(sample.getSpeed(), sample.getRpm(), sample.getGear(), timestamp);

        List<BehaviorEvent> events = List.copyOf(context.getEvents());
        events.forEach(state.getEvents()::add);
        metricsService.recordSampleProcessed();
        if (!events.isEmpty()) {
            log.debug("Vehicle {} produced {} behavior events", state.getVehicleId(), events.size());
        }
        return events;
    }

    private String skipReason(double dtSeconds) {
        if (dtSeconds > thresholds.getMaxSampleGapSec()) {
            return BehaviorMetricsService.SKIP_REASON_GAP;
        }
        if (dtSeconds < thresholds.getMinSampleIntervalSec()) {
            return BehaviorMetricsService.SKIP_REASON_DUPLICATE;
        }
        return null;
    }

    private static void captureMpg(VehicleBehaviorState state, TelemetrySample sample) {
        if (sample.getKalmanMpg() != null && sample.getKalmanMpg() > 0) {
            state.getKalmanMpgSamples().add(sample.getKalmanMpg());
        }
        if (sample.getEcuMpg() != null && sample.getEcuMpg() > 0) {
            state.getEcuMpgSamples().add(sample.getEcuMpg());
        }
    }

    /**
     * Advance the shared scoring day when a sample from a later UTC date shows up.
     * Exactly one caller wins the transition and sweeps every tracked vehicle;
     * vehicles processed concurrently catch up in {@link #applyDailyReset}.
     */
    private void rollScoringDay(Instant timestamp) {
        LocalDate sampleDay = LocalDate.ofInstant(timestamp, ZoneOffset.UTC);
        while (true) {
            LocalDate current = currentScoringDay.get();
            if (current != null && !sampleDay.isAfter(current)) {
                return;
            }
            if (currentScoringDay.compareAndSet(current, sampleDay)) {
                if (current != null) {
                    log.info("Daily reset of behavior counters: {} -> {}", current, sampleDay);
                    stateStore.forEachVehicle(this::applyDailyReset);
                    metricsService.recordDailyReset();
                }
                return;
            }
        }
    }

    // caller holds the vehicle lock
    private void applyDailyReset(VehicleBehaviorState state) {
        LocalDate day = currentScoringDay.get();
        if (day != null && state.getLastResetEpochDay() < day.toEpochDay()) {
            state.resetDaily(day.toEpochDay());
        }
    }

    private static void validate(String vehicleId, TelemetrySample sample) {
        if (vehicleId == null || vehicleId.isBlank()) {
            throw new InvalidTelemetryException("Vehicle id is required");
        }
        if (sample == null) {
            throw new InvalidTelemetryException("Telemetry sample is required for vehicle " + vehicleId);
        }
        if (sample.getTimestamp() == null) {
            throw new InvalidTelemetryException("Telemetry sample for vehicle " + vehicleId + " has no timestamp");
        }
    }
}
