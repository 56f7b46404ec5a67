package com.fuelcopilot.behavior.detection;

import com.fuelcopilot.behavior.config.BehaviorThresholds;
import com.fuelcopilot.behavior.model.BehaviorEvent;
import com.fuelcopilot.behavior.model.TelemetrySample;
import com.fuelcopilot.behavior.state.VehicleBehaviorState;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Everything a detector needs for one sample: the reading, the vehicle's
 * record (locked by the caller), the elapsed time since the previous reading
 * and the sink for emitted events.
 */
@Getter
@Builder
public class DetectionContext {

    private final String vehicleId;
    private final TelemetrySample sample;
    private final VehicleBehaviorState state;
    private final BehaviorThresholds thresholds;

    // Seconds since the previous accepted reading; 0 on a vehicle's first sample
    private final double dtSeconds;

    @Builder.Default
    private final List<BehaviorEvent> events = new ArrayList<>();

    public Instant getTimestamp() {
        return sample.getTimestamp();
    }

    public void emit(BehaviorEvent event) {
        events.add(event);
    }

    /**
     * Speed change rate in mph/s against the previous reading, empty when either
     * speed is missing or no time has elapsed.
     */
    public OptionalDouble speedRate() {
        Double speed = sample.getSpeed();
        Double lastSpeed = state.getLastSpeed();
        if (speed == null || lastSpeed == null || dtSeconds <= 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of((speed - lastSpeed) / dtSeconds);
    }

    public BehaviorEvent.BehaviorEventBuilder eventBuilder() {
        return BehaviorEvent.builder()
                .vehicleId(vehicleId)
                .timestamp(getTimestamp());
    }
}
