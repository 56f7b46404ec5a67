package com.fuelcopilot.behavior.detection;

import com.fuelcopilot.behavior.model.BehaviorEvent;
import com.fuelcopilot.behavior.model.BehaviorType;
import com.fuelcopilot.behavior.model.SeverityLevel;
import com.fuelcopilot.behavior.state.VehicleBehaviorState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Two-state machine shared by the duration-gated detectors.
 *
 * <p><b>Inactive</b> (no start timestamp) moves to <b>active</b> the first time
 * the condition holds. While active, every sample adds its elapsed time to the
 * category's duration counter and fuel-waste accumulator. Once the episode is
 * long enough an event is emitted; further events follow only when the severity
 * escalates. When the condition clears the start timestamp is dropped, but the
 * accumulated seconds and gallons stay until the daily reset.
 *
 * <p>Samples missing an input the condition needs leave the machine untouched.
 */
@Slf4j
@RequiredArgsConstructor
public abstract class SustainedConditionDetector implements BehaviorDetector {

    protected final FuelWasteAccountant fuelWasteAccountant;

    protected abstract BehaviorType behaviorType();

    protected abstract boolean canEvaluate(DetectionContext context);

    protected abstract boolean isConditionMet(DetectionContext context);

    /**
     * Severity warranted by an episode of {@code durationSeconds}, empty while
     * the episode is still too short to report.
     */
    protected abstract Optional<SeverityLevel> severityFor(DetectionContext context, double durationSeconds);

    /**
     * Builds the event body; vehicle, timestamp, type, severity, duration and
     * fuel waste are filled in by the caller.
     */
    protected abstract BehaviorEvent.BehaviorEventBuilder describe(DetectionContext context,
                                                                   BehaviorEvent.BehaviorEventBuilder builder,
                                                                   SeverityLevel severity);

    /**
     * Multiplier on the per-minute fuel coefficient
     */
    protected double wasteScale(DetectionContext context) {
        return 1.0;
    }

    @Override
    public final void detect(DetectionContext context) {
        if (!canEvaluate(context)) {
            return;
        }
        BehaviorType type = behaviorType();
        VehicleBehaviorState state = context.getState();

        if (!isConditionMet(context)) {
            if (state.conditionStart(type) != null) {
                log.debug("{} cleared for vehicle {}", type, context.getVehicleId());
            }
            state.endCondition(type);
            return;
        }

        Instant start = state.conditionStart(type);
        if (start == null) {
            start = context.getTimestamp();
            state.setConditionStart(type, start);
        }

        double dt = context.getDtSeconds();
        double scale = wasteScale(context);
        state.addConditionSeconds(type, dt);
        fuelWasteAccountant.recordActiveTime(state, type, dt, scale);

        double durationSeconds = Duration.between(start, context.getTimestamp()).toMillis() / 1000.0;
        Optional<SeverityLevel> severity = severityFor(context, durationSeconds);
        if (severity.isEmpty()) {
            return;
        }
        SeverityLevel reported = state.reportedSeverity(type);
        if (reported != null && reported.isAtLeast(severity.get())) {
            return;
        }

        state.markReported(type, severity.get());
        BehaviorEvent.BehaviorEventBuilder builder = context.eventBuilder()
                .behaviorType(type)
                .severity(severity.get())
                .durationSeconds(durationSeconds)
                .fuelWasteGallons(fuelWasteAccountant.sustainedGallons(type, durationSeconds, scale));
        context.emit(describe(context, builder, severity.get()).build());
    }
}
