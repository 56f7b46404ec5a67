package com.fuelcopilot.behavior.detection;

import com.fuelcopilot.behavior.config.BehaviorThresholds;
import com.fuelcopilot.behavior.model.BehaviorType;
import com.fuelcopilot.behavior.state.VehicleBehaviorState;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Estimates wasted fuel per behavior category and books it on the vehicle's
 * accumulators. Instantaneous behaviors cost a fixed amount per event; sustained
 * ones cost gallons per minute of active time.
 */
@Component
@RequiredArgsConstructor
public class FuelWasteAccountant {

    private final BehaviorThresholds thresholds;

    /**
     * Books {@code multiplier} times the per-event coefficient.
     *
     * @return gallons booked
     */
    public double recordOccurrence(VehicleBehaviorState state, BehaviorType type, double multiplier) {
        double gallons = perEventGallons(type) * multiplier;
        state.addFuelWaste(type, gallons);
        return gallons;
    }

    /**
     * Books {@code seconds} of active time, scaled by {@code scale}
     * (mph over the baseline for overspeeding, 1 otherwise).
     *
     * @return gallons booked
     */
    public double recordActiveTime(VehicleBehaviorState state, BehaviorType type, double seconds, double scale) {
        double gallons = sustainedGallons(type, seconds, scale);
        state.addFuelWaste(type, gallons);
        return gallons;
    }

    /**
     * Waste attributable to one sustained episode of {@code durationSeconds}, without booking it
     */
    public double sustainedGallons(BehaviorType type, double durationSeconds, double scale) {
        return (durationSeconds / 60.0) * perMinuteGallons(type) * scale;
    }

    public double perEventGallons(BehaviorType type) {
        return switch (type) {
            case HARD_ACCELERATION -> thresholds.getFuelWasteHardAccelGal();
            case HARD_BRAKING -> thresholds.getFuelWasteHardBrakeGal();
            case EXCESSIVE_RPM, WRONG_GEAR, OVERSPEEDING ->
                    throw new IllegalArgumentException(type + " is charged per minute, not per event");
        };
    }

    public double perMinuteGallons(BehaviorType type) {
        return switch (type) {
            case EXCESSIVE_RPM -> thresholds.getFuelWasteHighRpmGalPerMin();
            case WRONG_GEAR -> thresholds.getFuelWasteWrongGearGalPerMin();
            case OVERSPEEDING -> thresholds.getFuelWasteOverspeedingGalPerMin();
            case HARD_ACCELERATION, HARD_BRAKING ->
                    throw new IllegalArgumentException(type + " is charged per event, not per minute");
        };
    }
}
