package com.fuelcopilot.behavior.scoring;

import com.fuelcopilot.behavior.config.BehaviorThresholds;
import com.fuelcopilot.behavior.exception.InvalidTelemetryException;
import com.fuelcopilot.behavior.model.BehaviorType;
import com.fuelcopilot.behavior.model.DriverGrade;
import com.fuelcopilot.behavior.model.HeavyFootScore;
import com.fuelcopilot.behavior.state.VehicleStateSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;

/**
 * Heavy-Foot Scorer
 *
 * <p>Turns a vehicle's accumulated counters into a weighted 0-100 score.
 * Each category is compared to what a reasonable driver produces over the same
 * driving time; only the excess is penalized.
 *
 * <ul>
 *   <li>Acceleration (30%): 2 hard accelerations per driving hour tolerated, 3 points each above</li>
 *   <li>Braking (20%): 3 hard brakes per driving hour tolerated, 2 points each above</li>
 *   <li>RPM (20%): 10% of driving time above the excessive band tolerated, 3 points per % above</li>
 *   <li>Gear (15%): 5% of driving time in the wrong gear tolerated, 4 points per % above</li>
 *   <li>Speed (15%): 5% of driving time overspeeding tolerated, 3 points per % above</li>
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HeavyFootScorer {

    static final double ACCELERATION_WEIGHT = 0.30;
    static final double BRAKING_WEIGHT = 0.20;
    static final double RPM_WEIGHT = 0.20;
    static final double GEAR_WEIGHT = 0.15;
    static final double SPEED_WEIGHT = 0.15;

    // share of the period assumed to be spent driving when the caller doesn't know
    static final double DEFAULT_DRIVING_SHARE = 0.4;
    static final double MIN_DRIVING_HOURS = 1.0;

    private static final double EXPECTED_ACCELS_PER_HOUR = 2.0;
    private static final double EXPECTED_BRAKES_PER_HOUR = 3.0;
    private static final double EXPECTED_HIGH_RPM_PCT = 10.0;
    private static final double EXPECTED_WRONG_GEAR_PCT = 5.0;
    private static final double EXPECTED_OVERSPEEDING_PCT = 5.0;

    private static final double ACCEL_PENALTY_PER_EVENT = 3.0;
    private static final double BRAKE_PENALTY_PER_EVENT = 2.0;
    private static final double RPM_PENALTY_PER_PCT = 3.0;
    private static final double GEAR_PENALTY_PER_PCT = 4.0;
    private static final double SPEED_PENALTY_PER_PCT = 3.0;

    private final Clock clock;

    /**
     * @param periodHours  length of the scoring period
     * @param drivingHours hours actually driven in the period, or null to estimate
     *                     it as 40% of the period (never below one hour)
     */
    public HeavyFootScore score(VehicleStateSnapshot snapshot, double periodHours, Double drivingHours) {
        if (periodHours <= 0) {
            throw new InvalidTelemetryException("Scoring period must be positive, got " + periodHours);
        }
        if (drivingHours != null && drivingHours < 0) {
            throw new InvalidTelemetryException("Driving hours must not be negative, got " + drivingHours);
        }
        double hours = drivingHours != null
                ? drivingHours
                : Math.max(MIN_DRIVING_HOURS, periodHours * DEFAULT_DRIVING_SHARE);
        double drivingMinutes = hours * 60.0;

        double accelScore = subScore(
                snapshot.getHardAccelCount() - hours * EXPECTED_ACCELS_PER_HOUR, ACCEL_PENALTY_PER_EVENT);
        double brakeScore = subScore(
                snapshot.getHardBrakeCount() - hours * EXPECTED_BRAKES_PER_HOUR, BRAKE_PENALTY_PER_EVENT);
        double rpmScore = subScore(
                percentOfDriving(snapshot.getHighRpmSeconds(), drivingMinutes) - EXPECTED_HIGH_RPM_PCT,
                RPM_PENALTY_PER_PCT);
        // no wrong-gear time at all usually means no gear sensor; don't penalize missing data
        double gearScore = snapshot.getWrongGearSeconds() > 0
                ? subScore(percentOfDriving(snapshot.getWrongGearSeconds(), drivingMinutes) - EXPECTED_WRONG_GEAR_PCT,
                GEAR_PENALTY_PER_PCT)
                : 100.0;
        double speedScore = subScore(
                percentOfDriving(snapshot.getOverspeedingSeconds(), drivingMinutes) - EXPECTED_OVERSPEEDING_PCT,
                SPEED_PENALTY_PER_PCT);

        double overall = weightedScore(accelScore, brakeScore, rpmScore, gearScore, speedScore);

        Map<BehaviorType, Double> breakdown = new EnumMap<>(BehaviorType.class);
        for (BehaviorType type : BehaviorType.values()) {
            breakdown.put(type, snapshot.fuelWaste(type));
        }

        HeavyFootScore score = HeavyFootScore.builder()
                .vehicleId(snapshot.getVehicleId())
                .score(overall)
                .grade(DriverGrade.fromScore(overall))
                .accelerationScore(accelScore)
                .brakingScore(brakeScore)
                .rpmScore(rpmScore)
                .gearScore(gearScore)
                .speedScore(speedScore)
                .hardAccelCount(snapshot.getHardAccelCount())
                .hardBrakeCount(snapshot.getHardBrakeCount())
                .highRpmMinutes(snapshot.getHighRpmSeconds() / 60.0)
                .wrongGearMinutes(snapshot.getWrongGearSeconds() / 60.0)
                .overspeedingMinutes(snapshot.getOverspeedingSeconds() / 60.0)
                .totalFuelWasteGallons(snapshot.totalFuelWaste())
                .fuelWasteBreakdown(breakdown)
                .periodHours(periodHours)
                .drivingHours(hours)
                .calculatedAt(clock.instant())
                .build();

        log.debug("Heavy-foot score for {}: {} ({}), waste={} gal",
                snapshot.getVehicleId(), overall, score.getGrade(), score.getTotalFuelWasteGallons());
        return score;
    }

    public static double weightedScore(double accel, double brake, double rpm, double gear, double speed) {
        return accel * ACCELERATION_WEIGHT
                + brake * BRAKING_WEIGHT
                + rpm * RPM_WEIGHT
                + gear * GEAR_WEIGHT
                + speed * SPEED_WEIGHT;
    }

    private static double subScore(double excess, double penaltyFactor) {
        double penalty = Math.max(0.0, excess) * penaltyFactor;
        return Math.max(0.0, 100.0 - penalty);
    }

    private static double percentOfDriving(double seconds, double drivingMinutes) {
        return (seconds / 60.0) / Math.max(drivingMinutes, BehaviorThresholds.EPSILON) * 100.0;
    }
}
