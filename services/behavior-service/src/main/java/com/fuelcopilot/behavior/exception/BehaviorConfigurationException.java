package com.fuelcopilot.behavior.exception;

/**
 * Exception for inconsistent detection thresholds
 */
public class BehaviorConfigurationException extends BehaviorAnalyticsException {

    public BehaviorConfigurationException(String message) {
        super(message);
    }
}
