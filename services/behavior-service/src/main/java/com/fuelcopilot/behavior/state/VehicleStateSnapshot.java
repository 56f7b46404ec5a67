package com.fuelcopilot.behavior.state;

import com.fuelcopilot.behavior.model.BehaviorEvent;
import com.fuelcopilot.behavior.model.BehaviorType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time copy of a {@link VehicleBehaviorState}, taken under the vehicle's
 * lock. Pull-based readers (scoring, cross-validation, fleet aggregation) work on
 * snapshots so they never race an in-flight update.
 */
@Value
@Builder
public class VehicleStateSnapshot {

    String vehicleId;

    Double lastSpeed;
    Integer lastRpm;
    Integer lastGear;
    Instant lastTimestamp;

    boolean highRpmActive;
    boolean wrongGearActive;
    boolean overspeedingActive;

    int hardAccelCount;
    int hardBrakeCount;
    double highRpmSeconds;
    double wrongGearSeconds;
    double overspeedingSeconds;

    Map<BehaviorType, Double> fuelWaste;

    List<BehaviorEvent> events;
    List<Double> kalmanMpgSamples;
    List<Double> ecuMpgSamples;

    public double fuelWaste(BehaviorType type) {
        return fuelWaste.getOrDefault(type, 0.0);
    }

    public double totalFuelWaste() {
        return fuelWaste.values().stream().mapToDouble(Double::doubleValue).sum();
    }
}
