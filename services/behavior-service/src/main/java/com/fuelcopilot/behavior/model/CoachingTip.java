package com.fuelcopilot.behavior.model;

import lombok.Builder;
import lombok.Value;

/**
 * Personalized coaching message derived from a heavy-foot score
 */
@Value
@Builder
public class CoachingTip {

    public static final String SEVERITY_MILD = "mild";
    public static final String SEVERITY_MODERATE = "moderate";
    public static final String SEVERITY_SEVERE = "severe";
    public static final String SEVERITY_INFO = "info";

    // behavior category, or "overall_grade"
    String category;
    String severity;
    double priority;
    String message;
    double score;
}
