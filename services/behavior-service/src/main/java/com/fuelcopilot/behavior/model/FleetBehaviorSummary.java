package com.fuelcopilot.behavior.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Fleet-wide behavior summary: rankings, waste by category and recommendations
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FleetBehaviorSummary {

    private int fleetSize;
    private double averageScore;

    // worst first
    private List<HeavyFootScore> worstPerformers;
    // best first
    private List<HeavyFootScore> bestPerformers;

    private double totalFuelWasteGallons;
    private Map<BehaviorType, Double> wasteBreakdown;

    // null when no category wasted any fuel
    private FleetWasteIssue biggestIssue;

    // Fleet-wide 0-100 score per category
    private Map<BehaviorType, Double> categoryScores;

    // vehicles scoring below 70
    private int needsWorkCount;

    private List<String> recommendations;
    private Instant generatedAt;
}
