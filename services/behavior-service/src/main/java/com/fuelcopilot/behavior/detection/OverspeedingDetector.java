package com.fuelcopilot.behavior.detection;

import com.fuelcopilot.behavior.config.BehaviorThresholds;
import com.fuelcopilot.behavior.model.BehaviorEvent;
import com.fuelcopilot.behavior.model.BehaviorType;
import com.fuelcopilot.behavior.model.SeverityLevel;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Speed held at or above the warning band. Waste scales with every mph over the
 * baseline; severity follows the current speed band once a minute has elapsed.
 */
@Component
@Order(50)
public class OverspeedingDetector extends SustainedConditionDetector {

    public OverspeedingDetector(FuelWasteAccountant fuelWasteAccountant) {
        super(fuelWasteAccountant);
    }

    @Override
    protected BehaviorType behaviorType() {
        return BehaviorType.OVERSPEEDING;
    }

    @Override
    protected boolean canEvaluate(DetectionContext context) {
        return context.getSample().getSpeed() != null;
    }

    @Override
    protected boolean isConditionMet(DetectionContext context) {
        return context.getSample().getSpeed() >= context.getThresholds().getSpeedWarning();
    }

    @Override
    protected double wasteScale(DetectionContext context) {
        return mphOver(context);
    }

    @Override
    protected Optional<SeverityLevel> severityFor(DetectionContext context, double durationSeconds) {
        BehaviorThresholds thresholds = context.getThresholds();
        if (durationSeconds < thresholds.getOverspeedingMinDurationSec()) {
            return Optional.empty();
        }
        double speed = context.getSample().getSpeed();
        if (speed >= thresholds.getSpeedSevere()) {
            return Optional.of(SeverityLevel.SEVERE);
        } else if (speed >= thresholds.getSpeedExcessive()) {
            return Optional.of(SeverityLevel.MODERATE);
        }
        return Optional.of(SeverityLevel.MINOR);
    }

    @Override
    protected BehaviorEvent.BehaviorEventBuilder describe(DetectionContext context,
                                                          BehaviorEvent.BehaviorEventBuilder builder,
                                                          SeverityLevel severity) {
        return builder
                .value(context.getSample().getSpeed())
                .threshold(context.getThresholds().getSpeedWarning())
                .contextEntry("mph_over_limit", mphOver(context));
    }

    private static double mphOver(DetectionContext context) {
        return Math.max(0.0, context.getSample().getSpeed() - context.getThresholds().getOverspeedingBaselineMph());
    }
}
