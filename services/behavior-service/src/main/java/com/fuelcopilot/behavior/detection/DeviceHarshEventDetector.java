package com.fuelcopilot.behavior.detection;

import com.fuelcopilot.behavior.model.BehaviorType;
import com.fuelcopilot.behavior.model.SeverityLevel;
import com.fuelcopilot.behavior.model.TelemetrySample;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Harsh acceleration/braking counts reported by the accelerometer firmware.
 *
 * <p>Device reports are ground truth: they emit immediately, without duration
 * gating, and suppress the speed-delta detector of the same polarity for the sample.
 */
@Component
@Order(0)
@RequiredArgsConstructor
public class DeviceHarshEventDetector implements BehaviorDetector {

    static final String SOURCE_DEVICE = "device_accelerometer";

    private final FuelWasteAccountant fuelWasteAccountant;

    @Override
    public void detect(DetectionContext context) {
        TelemetrySample sample = context.getSample();
        if (sample.hasDeviceHarshAccel()) {
            report(context, BehaviorType.HARD_ACCELERATION, sample.getDeviceHarshAccel(),
                    context.getThresholds().getDeviceHarshAccelMg());
        }
        if (sample.hasDeviceHarshBrake()) {
            report(context, BehaviorType.HARD_BRAKING, sample.getDeviceHarshBrake(),
                    context.getThresholds().getDeviceHarshBrakeMg());
        }
    }

    private void report(DetectionContext context, BehaviorType type, int count, double thresholdMilliG) {
        context.getState().incrementOccurrences(type, count);
        double gallons = fuelWasteAccountant.recordOccurrence(context.getState(), type, count);

        context.emit(context.eventBuilder()
                .behaviorType(type)
                // firmware thresholds sit at the moderate tier
                .severity(SeverityLevel.MODERATE)
                .value(thresholdMilliG)
                .threshold(thresholdMilliG)
                .fuelWasteGallons(gallons)
                .contextEntry("source", SOURCE_DEVICE)
                .contextEntry("count", count)
                .build());
    }
}
