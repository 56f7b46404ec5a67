package com.fuelcopilot.behavior.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Result of comparing the Kalman-filtered MPG window against the ECU-reported one
 */
@Value
@Builder
public class MpgCrossValidation {

    String vehicleId;
    Instant timestamp;
    double kalmanMpg;
    double ecuMpg;
    double differencePct;
    // within tolerance?
    boolean valid;
    String recommendation;
}
