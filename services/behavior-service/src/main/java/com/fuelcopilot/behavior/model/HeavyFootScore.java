package com.fuelcopilot.behavior.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Composite driving-quality score for one vehicle.
 *
 * <p>100 is a perfect driver, 0 an extremely aggressive one. Computed on
 * demand from the vehicle's accumulated counters; never persisted here.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HeavyFootScore {

    private String vehicleId;
    private double score;
    private DriverGrade grade;

    // Component scores, 0-100
    private double accelerationScore;
    private double brakingScore;
    private double rpmScore;
    private double gearScore;
    private double speedScore;

    // Occurrences in the current scoring day
    private int hardAccelCount;
    private int hardBrakeCount;
    private double highRpmMinutes;
    private double wrongGearMinutes;
    private double overspeedingMinutes;

    // Fuel impact, gallons
    private double totalFuelWasteGallons;
    private Map<BehaviorType, Double> fuelWasteBreakdown;

    // Scoring period
    private double periodHours;
    private double drivingHours;
    private Instant calculatedAt;

    public double subScore(BehaviorType type) {
        return switch (type) {
            case HARD_ACCELERATION -> accelerationScore;
            case HARD_BRAKING -> brakingScore;
            case EXCESSIVE_RPM -> rpmScore;
            case WRONG_GEAR -> gearScore;
            case OVERSPEEDING -> speedScore;
        };
    }

    public double fuelWaste(BehaviorType type) {
        return fuelWasteBreakdown == null ? 0.0 : fuelWasteBreakdown.getOrDefault(type, 0.0);
    }
}
