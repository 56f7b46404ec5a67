package com.fuelcopilot.behavior.exception;

/**
 * Thrown when a caller hands the engine a sample or request that breaks the
 * processing contract (missing vehicle id, missing timestamp, bad period).
 */
public class InvalidTelemetryException extends BehaviorAnalyticsException {

    public InvalidTelemetryException(String message) {
        super(message);
    }
}
