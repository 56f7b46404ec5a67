package com.fuelcopilot.behavior.exception;

/**
 * Base exception for driver behavior analytics errors
 */
public class BehaviorAnalyticsException extends RuntimeException {

    public BehaviorAnalyticsException(String message) {
        super(message);
    }

    public BehaviorAnalyticsException(String message, Throwable cause) {
        super(message, cause);
    }
}
