package com.fuelcopilot.behavior.fleet;

import com.fuelcopilot.behavior.config.properties.BehaviorProperties;
import com.fuelcopilot.behavior.model.BehaviorType;
import com.fuelcopilot.behavior.model.FleetBehaviorSummary;
import com.fuelcopilot.behavior.model.FleetWasteIssue;
import com.fuelcopilot.behavior.model.HeavyFootScore;
import com.fuelcopilot.behavior.scoring.HeavyFootScorer;
import com.fuelcopilot.behavior.state.VehicleStateSnapshot;
import com.fuelcopilot.behavior.state.VehicleStateStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Fleet Behavior Aggregator
 *
 * <p>Scores every tracked vehicle and rolls the results up into rankings,
 * fuel waste per category and fleet-level training recommendations.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FleetBehaviorAggregator {

    static final double NEEDS_WORK_SCORE = 70.0;
    static final double IMMEDIATE_ATTENTION_SCORE = 50.0;
    static final int MAX_FLAGGED_IDS = 5;

    // per-vehicle daily count (or minutes) to category-score penalty
    private static final Map<BehaviorType, Double> CATEGORY_PENALTY = Map.of(
            BehaviorType.HARD_ACCELERATION, 8.0,
            BehaviorType.HARD_BRAKING, 6.0,
            BehaviorType.EXCESSIVE_RPM, 2.0,
            BehaviorType.WRONG_GEAR, 1.5,
            BehaviorType.OVERSPEEDING, 1.0);

    private final VehicleStateStore stateStore;
    private final HeavyFootScorer scorer;
    private final BehaviorProperties properties;
    private final Clock clock;

    /**
     * @return empty when no vehicle is tracked
     */
    public Optional<FleetBehaviorSummary> summarize() {
        List<VehicleStateSnapshot> snapshots = stateStore.snapshotAll();
        if (snapshots.isEmpty()) {
            log.debug("Fleet summary requested with no tracked vehicles");
            return Optional.empty();
        }

        double periodHours = properties.getFleet().getScoringPeriodHours();
        List<HeavyFootScore> scores = new ArrayList<>(snapshots.size());
        Map<BehaviorType, Double> waste = new EnumMap<>(BehaviorType.class);
        for (BehaviorType type : BehaviorType.values()) {
            waste.put(type, 0.0);
        }
        for (VehicleStateSnapshot snapshot : snapshots) {
            scores.add(scorer.score(snapshot, periodHours, null));
            for (BehaviorType type : BehaviorType.values()) {
                waste.merge(type, snapshot.fuelWaste(type), Double::sum);
            }
        }

        // ties broken by vehicle id so rankings are stable between calls
        Comparator<HeavyFootScore> worstFirst = Comparator.comparingDouble(HeavyFootScore::getScore)
                .thenComparing(HeavyFootScore::getVehicleId);
        List<HeavyFootScore> sorted = scores.stream().sorted(worstFirst).collect(Collectors.toList());

        int performerCount = properties.getFleet().getPerformerCount();
        List<HeavyFootScore> worst = sorted.stream().limit(performerCount).collect(Collectors.toList());
        List<HeavyFootScore> best = sorted.stream()
                .sorted(worstFirst.reversed())
                .limit(performerCount)
                .collect(Collectors.toList());

        double averageScore = scores.stream().mapToDouble(HeavyFootScore::getScore).average().orElse(0.0);
        double totalWaste = waste.values().stream().mapToDouble(Double::doubleValue).sum();
        FleetWasteIssue biggestIssue = biggestIssue(waste);
        int needsWork = (int) scores.stream().filter(s -> s.getScore() < NEEDS_WORK_SCORE).count();

        FleetBehaviorSummary summary = FleetBehaviorSummary.builder()
                .fleetSize(scores.size())
                .averageScore(averageScore)
                .worstPerformers(worst)
                .bestPerformers(best)
                .totalFuelWasteGallons(totalWaste)
                .wasteBreakdown(waste)
                .biggestIssue(biggestIssue)
                .categoryScores(categoryScores(scores))
                .needsWorkCount(needsWork)
                .recommendations(recommendations(sorted, averageScore, biggestIssue))
                .generatedAt(clock.instant())
                .build();

        log.info("Fleet behavior summary: {} vehicles, average score {}, total waste {} gal",
                summary.getFleetSize(), averageScore, totalWaste);
        return Optional.of(summary);
    }

    /**
     * Category with the most fuel wasted; the first category in declaration
     * order wins a tie. Null when nothing was wasted.
     */
    static FleetWasteIssue biggestIssue(Map<BehaviorType, Double> waste) {
        BehaviorType top = null;
        double topGallons = 0.0;
        for (BehaviorType type : BehaviorType.values()) {
            double gallons = waste.getOrDefault(type, 0.0);
            if (gallons > topGallons) {
                top = type;
                topGallons = gallons;
            }
        }
        if (top == null) {
            return null;
        }
        return FleetWasteIssue.builder().category(top).gallons(topGallons).build();
    }

    static Map<BehaviorType, Double> categoryScores(List<HeavyFootScore> scores) {
        int n = Math.max(1, scores.size());
        Map<BehaviorType, Double> averages = new EnumMap<>(BehaviorType.class);
        averages.put(BehaviorType.HARD_ACCELERATION,
                scores.stream().mapToDouble(HeavyFootScore::getHardAccelCount).sum() / n);
        averages.put(BehaviorType.HARD_BRAKING,
                scores.stream().mapToDouble(HeavyFootScore::getHardBrakeCount).sum() / n);
        averages.put(BehaviorType.EXCESSIVE_RPM,
                scores.stream().mapToDouble(HeavyFootScore::getHighRpmMinutes).sum() / n);
        averages.put(BehaviorType.WRONG_GEAR,
                scores.stream().mapToDouble(HeavyFootScore::getWrongGearMinutes).sum() / n);
        averages.put(BehaviorType.OVERSPEEDING,
                scores.stream().mapToDouble(HeavyFootScore::getOverspeedingMinutes).sum() / n);

        Map<BehaviorType, Double> categoryScores = new EnumMap<>(BehaviorType.class);
        averages.forEach((type, average) -> categoryScores.put(type,
                Math.max(0.0, Math.min(100.0, 100.0 - average * CATEGORY_PENALTY.get(type)))));
        return categoryScores;
    }

    static List<String> recommendations(List<HeavyFootScore> worstFirst, double averageScore,
                                        FleetWasteIssue biggestIssue) {
        List<String> recommendations = new ArrayList<>();

        if (averageScore < NEEDS_WORK_SCORE) {
            recommendations.add("Fleet average score is below 70 - consider driver training program");
        }

        if (biggestIssue != null) {
            dominantWasteTip(biggestIssue.getCategory()).ifPresent(recommendations::add);
        }

        List<String> outliers = worstFirst.stream()
                .filter(s -> s.getScore() < IMMEDIATE_ATTENTION_SCORE)
                .map(HeavyFootScore::getVehicleId)
                .collect(Collectors.toList());
        if (!outliers.isEmpty()) {
            recommendations.add(String.format("%d vehicles need immediate attention: %s",
                    outliers.size(), String.join(", ", outliers.subList(0, Math.min(MAX_FLAGGED_IDS, outliers.size())))));
        }
        return recommendations;
    }

    private static Optional<String> dominantWasteTip(BehaviorType category) {
        return switch (category) {
            case HARD_ACCELERATION -> Optional.of(
                    "Hard acceleration is primary fuel waste source - train drivers on smooth acceleration");
            case EXCESSIVE_RPM -> Optional.of(
                    "High RPM operation is wasting fuel - train drivers on optimal RPM range (1200-1600)");
            case WRONG_GEAR -> Optional.of(
                    "Wrong gear usage detected - drivers should upshift earlier to stay in torque band");
            case OVERSPEEDING -> Optional.of(
                    "Overspeeding is wasting fuel - each mph above 65 reduces efficiency by ~0.1 MPG");
            case HARD_BRAKING -> Optional.empty();
        };
    }
}
