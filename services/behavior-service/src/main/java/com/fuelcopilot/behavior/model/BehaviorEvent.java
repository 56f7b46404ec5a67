package com.fuelcopilot.behavior.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Single detected behavior occurrence. Emitted to the caller, never mutated.
 */
@Value
@Builder
public class BehaviorEvent {

    String vehicleId;
    Instant timestamp;
    BehaviorType behaviorType;
    SeverityLevel severity;

    // measured value that triggered detection and the threshold it crossed
    double value;
    double threshold;

    // 0 for instantaneous events
    double durationSeconds;
    double fuelWasteGallons;

    @Singular("contextEntry")
    Map<String, Object> context;

    public boolean isAtLeast(SeverityLevel level) {
        return severity.isAtLeast(level);
    }
}
