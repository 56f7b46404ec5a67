package com.fuelcopilot.behavior.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * One periodic telemetry reading for a vehicle.
 *
 * <p>Every numeric field is optional; a missing field disables only the
 * detectors that need it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TelemetrySample {

    private Instant timestamp;

    // GPS speed, mph
    private Double speed;
    private Integer rpm;
    private Integer gear;
    // Instantaneous consumption, gallons per hour
    private Double fuelRate;

    // ECU-reported fuel economy, MPG
    private Double ecuMpg;
    // Kalman-filtered fuel economy, MPG
    private Double kalmanMpg;

    // Brake pedal switch (0/1) and application pressure (psi)
    private Integer brakeSwitch;
    private Double brakePressure;

    // Harsh event counts reported by the accelerometer firmware
    private Integer deviceHarshAccel;
    private Integer deviceHarshBrake;

    // Selects the per-type max gear; null uses the default
    private String vehicleType;

    public boolean hasDeviceHarshAccel() {
        return deviceHarshAccel != null && deviceHarshAccel > 0;
    }

    public boolean hasDeviceHarshBrake() {
        return deviceHarshBrake != null && deviceHarshBrake > 0;
    }
}
