package com.fuelcopilot.behavior.detection;

import com.fuelcopilot.behavior.config.BehaviorThresholds;
import com.fuelcopilot.behavior.model.BehaviorType;
import com.fuelcopilot.behavior.model.SeverityLevel;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.OptionalDouble;

/**
 * Hard braking from the speed delta, mirror image of {@link AccelerationDetector}
 * on the negative side. Events carry the deceleration as a positive value.
 *
 * <p>The occurrence counter moves only when a tier matches; a mild slowdown
 * above the minor threshold books nothing.
 */
@Component
@Order(20)
@RequiredArgsConstructor
public class BrakingDetector implements BehaviorDetector {

    private final FuelWasteAccountant fuelWasteAccountant;

    @Override
    public void detect(DetectionContext context) {
        if (context.getSample().hasDeviceHarshBrake()) {
            return;
        }
        OptionalDouble rate = context.speedRate();
        if (rate.isEmpty()) {
            return;
        }

        double mphPerSecond = rate.getAsDouble();
        BehaviorThresholds thresholds = context.getThresholds();
        if (mphPerSecond <= thresholds.getBrakeSevereThreshold()) {
            report(context, mphPerSecond, SeverityLevel.SEVERE, thresholds.getBrakeSevereThreshold(), 2.0);
        } else if (mphPerSecond <= thresholds.getBrakeModerateThreshold()) {
            report(context, mphPerSecond, SeverityLevel.MODERATE, thresholds.getBrakeModerateThreshold(), 1.0);
        } else if (mphPerSecond <= thresholds.getBrakeMinorThreshold()) {
            report(context, mphPerSecond, SeverityLevel.MINOR, thresholds.getBrakeMinorThreshold(), 0.5);
        }
    }

    private void report(DetectionContext context, double mphPerSecond, SeverityLevel severity,
                        double threshold, double wasteMultiplier) {
        context.getState().incrementOccurrences(BehaviorType.HARD_BRAKING, 1);
        double gallons = fuelWasteAccountant.recordOccurrence(
                context.getState(), BehaviorType.HARD_BRAKING, wasteMultiplier);

        context.emit(context.eventBuilder()
                .behaviorType(BehaviorType.HARD_BRAKING)
                .severity(severity)
                .value(Math.abs(mphPerSecond))
                .threshold(Math.abs(threshold))
                .fuelWasteGallons(gallons)
                .contextEntry("unit", "mph/s")
                .contextEntry("indirect_waste", true)
                .build());
    }
}
