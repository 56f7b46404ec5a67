package com.fuelcopilot.behavior.detection;

import com.fuelcopilot.behavior.config.BehaviorThresholds;
import com.fuelcopilot.behavior.model.BehaviorType;
import com.fuelcopilot.behavior.model.SeverityLevel;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.OptionalDouble;

/**
 * Hard acceleration from the speed delta between consecutive readings.
 *
 * <p>Tiers are checked severe first, so a single reading is classified once.
 * Severe events weigh twice the base fuel coefficient, minor ones half.
 */
@Component
@Order(10)
@RequiredArgsConstructor
public class AccelerationDetector implements BehaviorDetector {

    private final FuelWasteAccountant fuelWasteAccountant;

    @Override
    public void detect(DetectionContext context) {
        if (context.getSample().hasDeviceHarshAccel()) {
            return;
        }
        OptionalDouble rate = context.speedRate();
        if (rate.isEmpty()) {
            return;
        }

        double mphPerSecond = rate.getAsDouble();
        BehaviorThresholds thresholds = context.getThresholds();
        if (mphPerSecond >= thresholds.getAccelSevereThreshold()) {
            report(context, mphPerSecond, SeverityLevel.SEVERE, thresholds.getAccelSevereThreshold(), 2.0);
        } else if (mphPerSecond >= thresholds.getAccelModerateThreshold()) {
            report(context, mphPerSecond, SeverityLevel.MODERATE, thresholds.getAccelModerateThreshold(), 1.0);
        } else if (mphPerSecond >= thresholds.getAccelMinorThreshold()) {
            report(context, mphPerSecond, SeverityLevel.MINOR, thresholds.getAccelMinorThreshold(), 0.5);
        }
    }

    private void report(DetectionContext context, double mphPerSecond, SeverityLevel severity,
                        double threshold, double wasteMultiplier) {
        context.getState().incrementOccurrences(BehaviorType.HARD_ACCELERATION, 1);
        double gallons = fuelWasteAccountant.recordOccurrence(
                context.getState(), BehaviorType.HARD_ACCELERATION, wasteMultiplier);

        context.emit(context.eventBuilder()
                .behaviorType(BehaviorType.HARD_ACCELERATION)
                .severity(severity)
                .value(mphPerSecond)
                .threshold(threshold)
                .fuelWasteGallons(gallons)
                .contextEntry("unit", "mph/s")
                .build());
    }
}
