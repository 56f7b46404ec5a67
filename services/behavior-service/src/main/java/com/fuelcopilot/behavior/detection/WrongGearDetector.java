package com.fuelcopilot.behavior.detection;

import com.fuelcopilot.behavior.config.BehaviorThresholds;
import com.fuelcopilot.behavior.model.BehaviorEvent;
import com.fuelcopilot.behavior.model.BehaviorType;
import com.fuelcopilot.behavior.model.SeverityLevel;
import com.fuelcopilot.behavior.model.TelemetrySample;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * High RPM in a gear that could still upshift, above launch speed.
 * Needs gear, RPM and speed on the sample; the top gear comes from the vehicle type.
 */
@Component
@Order(40)
public class WrongGearDetector extends SustainedConditionDetector {

    public WrongGearDetector(FuelWasteAccountant fuelWasteAccountant) {
        super(fuelWasteAccountant);
    }

    @Override
    protected BehaviorType behaviorType() {
        return BehaviorType.WRONG_GEAR;
    }

    @Override
    protected boolean canEvaluate(DetectionContext context) {
        TelemetrySample sample = context.getSample();
        return sample.getGear() != null && sample.getRpm() != null && sample.getSpeed() != null;
    }

    @Override
    protected boolean isConditionMet(DetectionContext context) {
        TelemetrySample sample = context.getSample();
        BehaviorThresholds thresholds = context.getThresholds();
        return sample.getRpm() >= thresholds.getWrongGearRpmThreshold()
                && sample.getGear() < thresholds.maxGearFor(sample.getVehicleType())
                && sample.getSpeed() > thresholds.getWrongGearMinSpeedMph();
    }

    @Override
    protected Optional<SeverityLevel> severityFor(DetectionContext context, double durationSeconds) {
        return durationSeconds >= context.getThresholds().getWrongGearMinDurationSec()
                ? Optional.of(SeverityLevel.MODERATE)
                : Optional.empty();
    }

    @Override
    protected BehaviorEvent.BehaviorEventBuilder describe(DetectionContext context,
                                                          BehaviorEvent.BehaviorEventBuilder builder,
                                                          SeverityLevel severity) {
        TelemetrySample sample = context.getSample();
        return builder
                .value(sample.getRpm())
                .threshold(context.getThresholds().getWrongGearRpmThreshold())
                .contextEntry("gear", sample.getGear())
                .contextEntry("speed", sample.getSpeed())
                .contextEntry("should_upshift", true)
                .contextEntry("message", String.format("RPM %d in gear %d, could upshift", sample.getRpm(), sample.getGear()));
    }
}
