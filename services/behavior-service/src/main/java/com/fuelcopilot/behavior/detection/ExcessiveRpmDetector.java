package com.fuelcopilot.behavior.detection;

import com.fuelcopilot.behavior.config.BehaviorThresholds;
import com.fuelcopilot.behavior.model.BehaviorEvent;
import com.fuelcopilot.behavior.model.BehaviorType;
import com.fuelcopilot.behavior.model.SeverityLevel;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Engine held at or above the excessive RPM band.
 *
 * <p>Moderate after the minimum duration, severe when at redline, critical once
 * redline has been held for the critical duration.
 */
@Component
@Order(30)
public class ExcessiveRpmDetector extends SustainedConditionDetector {

    public ExcessiveRpmDetector(FuelWasteAccountant fuelWasteAccountant) {
        super(fuelWasteAccountant);
    }

    @Override
    protected BehaviorType behaviorType() {
        return BehaviorType.EXCESSIVE_RPM;
    }

    @Override
    protected boolean canEvaluate(DetectionContext context) {
        Integer rpm = context.getSample().getRpm();
        return rpm != null && rpm > 0;
    }

    @Override
    protected boolean isConditionMet(DetectionContext context) {
        return context.getSample().getRpm() >= context.getThresholds().getRpmExcessive();
    }

    @Override
    protected Optional<SeverityLevel> severityFor(DetectionContext context, double durationSeconds) {
        BehaviorThresholds thresholds = context.getThresholds();
        boolean atRedline = context.getSample().getRpm() >= thresholds.getRpmRedline();
        if (atRedline && durationSeconds >= thresholds.getRpmCriticalDurationSec()) {
            return Optional.of(SeverityLevel.CRITICAL);
        }
        if (durationSeconds >= thresholds.getRpmMinDurationSec()) {
            return Optional.of(atRedline ? SeverityLevel.SEVERE : SeverityLevel.MODERATE);
        }
        return Optional.empty();
    }

    @Override
    protected BehaviorEvent.BehaviorEventBuilder describe(DetectionContext context,
                                                          BehaviorEvent.BehaviorEventBuilder builder,
                                                          SeverityLevel severity) {
        BehaviorThresholds thresholds = context.getThresholds();
        int threshold = severity == SeverityLevel.CRITICAL ? thresholds.getRpmRedline() : thresholds.getRpmExcessive();
        return builder
                .value(context.getSample().getRpm())
                .threshold(threshold)
                .contextEntry("gear", context.getSample().getGear())
                .contextEntry("speed", context.getSample().getSpeed());
    }
}
