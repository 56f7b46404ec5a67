package com.fuelcopilot.behavior.detection;

/**
 * One detection rule. Reads and updates the vehicle's record and emits zero or
 * more events into the context. Detectors run in {@link org.springframework.core.annotation.Order}
 * order: device reports first, then the delta and sustained detectors.
 */
public interface BehaviorDetector {

    void detect(DetectionContext context);
}
