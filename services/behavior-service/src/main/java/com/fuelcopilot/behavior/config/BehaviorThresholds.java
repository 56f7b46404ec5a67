package com.fuelcopilot.behavior.config;

import com.fuelcopilot.behavior.exception.BehaviorConfigurationException;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Immutable threshold and coefficient table shared by every detector, the
 * fuel-waste accountant, the scorer and the cross-validator.
 *
 * <p>Built once at startup from {@link com.fuelcopilot.behavior.config.properties.BehaviorProperties}
 * and never mutated afterwards. Defaults are tuned for class 8 diesel tractors.
 */
@Value
@Builder(toBuilder = true)
public class BehaviorThresholds {

    /** Floor used wherever a ratio would otherwise divide by zero. */
    public static final double EPSILON = 1e-6;

    // Hard acceleration (mph per second)
    @Builder.Default double accelMinorThreshold = 3.0;
    @Builder.Default double accelModerateThreshold = 4.5;
    @Builder.Default double accelSevereThreshold = 6.0;

    // Hard braking (negative mph per second)
    @Builder.Default double brakeMinorThreshold = -4.0;
    @Builder.Default double brakeModerateThreshold = -6.0;
    @Builder.Default double brakeSevereThreshold = -8.0;

    // RPM bands
    @Builder.Default int rpmOptimalMin = 1200;
    @Builder.Default int rpmOptimalMax = 1600;
    @Builder.Default int rpmHighWarning = 1800;
    @Builder.Default int rpmExcessive = 2100;
    @Builder.Default int rpmRedline = 2500;
    @Builder.Default double rpmMinDurationSec = 5.0;
    @Builder.Default double rpmCriticalDurationSec = 10.0;

    // Wrong gear
    @Builder.Default int wrongGearRpmThreshold = 1700;
    @Builder.Default double wrongGearMinDurationSec = 5.0;
    @Builder.Default double wrongGearMinSpeedMph = 25.0;
    @Builder.Default int defaultMaxGear = 13;
    @Builder.Default Map<String, Integer> maxGearByVehicleType = Map.of();

    // Speed bands (mph)
    @Builder.Default double speedWarning = 65.0;
    @Builder.Default double speedExcessive = 70.0;
    @Builder.Default double speedSevere = 75.0;
    @Builder.Default double overspeedingMinDurationSec = 60.0;
    @Builder.Default double overspeedingBaselineMph = 65.0;

    // Fuel waste coefficients
    @Builder.Default double fuelWasteHardAccelGal = 0.05;
    @Builder.Default double fuelWasteHardBrakeGal = 0.02;
    @Builder.Default double fuelWasteHighRpmGalPerMin = 0.02;
    @Builder.Default double fuelWasteWrongGearGalPerMin = 0.03;
    @Builder.Default double fuelWasteOverspeedingGalPerMin = 0.01;

    // Device accelerometer thresholds, reported as the event value (milli-g)
    @Builder.Default double deviceHarshAccelMg = 280.0;
    @Builder.Default double deviceHarshBrakeMg = 320.0;

    // Sample gap policy (seconds)
    @Builder.Default double minSampleIntervalSec = 1.0;
    @Builder.Default double maxSampleGapSec = 300.0;

    // MPG cross-validation
    @Builder.Default int mpgWindowCapacity = 10;
    @Builder.Default int mpgMinSamples = 5;
    @Builder.Default double mpgCrossValidationTolerancePct = 15.0;

    @Builder.Default int eventLogCapacity = 1000;

    public static BehaviorThresholds defaults() {
        return BehaviorThresholds.builder().build();
    }

    /**
     * Highest gear for the given vehicle type, falling back to the default
     * when the type is unknown or absent.
     */
    public int maxGearFor(String vehicleType) {
        if (vehicleType == null || vehicleType.isBlank()) {
            return defaultMaxGear;
        }
        return maxGearByVehicleType.getOrDefault(vehicleType, defaultMaxGear);
    }

    /**
     * Rejects tables whose tiers are out of order or whose coefficients are negative.
     *
     * @return this table, for chaining at bean creation
     */
    public BehaviorThresholds validate() {
        requireOrdered("acceleration", accelMinorThreshold, accelModerateThreshold, accelSevereThreshold);
        // braking tiers grow more negative
        requireOrdered("braking", -brakeMinorThreshold, -brakeModerateThreshold, -brakeSevereThreshold);
        if (accelMinorThreshold <= 0 || brakeMinorThreshold >= 0) {
            throw new BehaviorConfigurationException(
                    "Acceleration thresholds must be positive and braking thresholds negative");
        }
        if (!(rpmOptimalMin < rpmOptimalMax && rpmOptimalMax <= rpmHighWarning
                && rpmHighWarning <= rpmExcessive && rpmExcessive <= rpmRedline)) {
            throw new BehaviorConfigurationException("RPM bands must be ascending: optimal-min < optimal-max <= "
                    + "high-warning <= excessive <= redline");
        }
        if (rpmCriticalDurationSec < rpmMinDurationSec) {
            throw new BehaviorConfigurationException("RPM critical duration must not be shorter than the minimum duration");
        }
        requireOrdered("speed", speedWarning, speedExcessive, speedSevere);
        if (defaultMaxGear < 1 || maxGearByVehicleType.values().stream().anyMatch(g -> g == null || g < 1)) {
            throw new BehaviorConfigurationException("Max gear must be at least 1");
        }
        if (fuelWasteHardAccelGal < 0 || fuelWasteHardBrakeGal < 0 || fuelWasteHighRpmGalPerMin < 0
                || fuelWasteWrongGearGalPerMin < 0 || fuelWasteOverspeedingGalPerMin < 0) {
            throw new BehaviorConfigurationException("Fuel waste coefficients must not be negative");
        }
        if (minSampleIntervalSec <= 0 || maxSampleGapSec <= minSampleIntervalSec) {
            throw new BehaviorConfigurationException("Sample gap policy requires 0 < min interval < max gap");
        }
        if (mpgWindowCapacity < 1 || mpgMinSamples < 1 || mpgMinSamples > mpgWindowCapacity) {
            throw new BehaviorConfigurationException("MPG minimum samples must fit in the MPG window");
        }
        if (mpgCrossValidationTolerancePct < 0) {
            throw new BehaviorConfigurationException("MPG cross-validation tolerance must not be negative");
        }
        if (eventLogCapacity < 1) {
            throw new BehaviorConfigurationException("Event log capacity must be at least 1");
        }
        return this;
    }

    private static void requireOrdered(String category, double minor, double moderate, double severe) {
        if (!(minor < moderate && moderate < severe)) {
            throw new BehaviorConfigurationException(String.format(
                    "%s thresholds must escalate minor < moderate < severe (got %.2f, %.2f, %.2f)",
                    category, minor, moderate, severe));
        }
    }
}
