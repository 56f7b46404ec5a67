package com.fuelcopilot.behavior.coaching;

import com.fuelcopilot.behavior.model.BehaviorType;
import com.fuelcopilot.behavior.model.CoachingTip;
import com.fuelcopilot.behavior.model.DriverGrade;
import com.fuelcopilot.behavior.model.HeavyFootScore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Builds driver-facing coaching messages from a heavy-foot score.
 *
 * <p>Every category scoring below {@value #TIP_THRESHOLD} gets one tip, worded
 * by how far the driver is off; the worst categories come first. A closing tip
 * on the overall grade is always included when there is room.
 */
@Slf4j
@Service
public class CoachingTipService {

    static final double TIP_THRESHOLD = 85.0;
    static final double MILD_FLOOR = 80.0;
    static final double MODERATE_FLOOR = 60.0;
    static final double GRADE_TIP_PRIORITY = 5.0;
    static final String OVERALL_GRADE_CATEGORY = "overall_grade";

    public List<CoachingTip> tipsFor(HeavyFootScore score, int maxTips) {
        if (maxTips <= 0) {
            return List.of();
        }
        List<CoachingTip> tips = new ArrayList<>();

        for (BehaviorType type : BehaviorType.values()) {
            double subScore = score.subScore(type);
            if (subScore >= TIP_THRESHOLD) {
                continue;
            }
            String severity = severityFor(subScore);
            tips.add(CoachingTip.builder()
                    .category(type.getWasteCategory())
                    .severity(severity)
                    .priority(100.0 - subScore)
                    .message(message(type, severity, score))
                    .score(subScore)
                    .build());
        }

        tips.add(CoachingTip.builder()
                .category(OVERALL_GRADE_CATEGORY)
                .severity(CoachingTip.SEVERITY_INFO)
                .priority(GRADE_TIP_PRIORITY)
                .message(gradeMessage(score.getGrade()))
                .score(score.getScore())
                .build());

        List<CoachingTip> ranked = tips.stream()
                .sorted(Comparator.comparingDouble(CoachingTip::getPriority).reversed())
                .limit(maxTips)
                .collect(Collectors.toList());
        log.debug("Generated {} coaching tips for {}", ranked.size(), score.getVehicleId());
        return ranked;
    }

    static String severityFor(double subScore) {
        if (subScore >= MILD_FLOOR) {
            return CoachingTip.SEVERITY_MILD;
        } else if (subScore >= MODERATE_FLOOR) {
            return CoachingTip.SEVERITY_MODERATE;
        }
        return CoachingTip.SEVERITY_SEVERE;
    }

    private static String message(BehaviorType type, String severity, HeavyFootScore score) {
        return switch (type) {
            case HARD_ACCELERATION -> switch (severity) {
                case CoachingTip.SEVERITY_MILD ->
                        "Tip: Accelerate smoothly over 10-15 seconds to improve fuel economy by up to 10%.";
                case CoachingTip.SEVERITY_MODERATE -> format(
                        "%d hard accelerations today. Try pretending there's an egg under the pedal.",
                        score.getHardAccelCount());
                default -> format(
                        "Aggressive acceleration detected. Each event wastes 0.05 gal. Today: ~%.2f gal lost.",
                        score.fuelWaste(type));
            };
            case HARD_BRAKING -> switch (severity) {
                case CoachingTip.SEVERITY_MILD ->
                        "Tip: Anticipate stops by coasting. Looking further ahead saves brakes AND fuel.";
                case CoachingTip.SEVERITY_MODERATE ->
                        "Hard braking wastes momentum. Each event loses energy equivalent to ~0.02 gallons.";
                default ->
                        "Frequent hard braking detected. This indicates late reaction or tailgating. Safety concern.";
            };
            case EXCESSIVE_RPM -> switch (severity) {
                case CoachingTip.SEVERITY_MILD ->
                        "Tip: Sweet spot is 1200-1600 RPM. Your engine's peak torque = best efficiency.";
                case CoachingTip.SEVERITY_MODERATE -> format(
                        "%.0f minutes above the optimal RPM band today. Upshift earlier to save fuel.",
                        score.getHighRpmMinutes());
                default ->
                        "Excessive RPM burning fuel fast. Every minute at 2100+ RPM wastes ~0.02 gal extra.";
            };
            case WRONG_GEAR -> switch (severity) {
                case CoachingTip.SEVERITY_MILD ->
                        "Tip: Match RPM to speed. If RPM > 1700 and you can upshift, do it!";
                case CoachingTip.SEVERITY_MODERATE -> format(
                        "Wrong gear detected %.0f+ minutes. Upshifting earlier saves ~0.03 gal/min.",
                        score.getWrongGearMinutes());
                default -> format(
                        "Significant wrong gear usage. This is costing ~%.2f gal/day in extra fuel.",
                        score.fuelWaste(type));
            };
            case OVERSPEEDING -> switch (severity) {
                case CoachingTip.SEVERITY_MILD ->
                        "Tip: 65 mph = optimal. Each mph above reduces efficiency by ~0.1 MPG.";
                case CoachingTip.SEVERITY_MODERATE -> format(
                        "%.0f minutes overspeeding today. Slowing to 65 mph saves fuel on every trip.",
                        score.getOverspeedingMinutes());
                default ->
                        "Speed consistently above 70 mph. Fuel economy drops ~15% compared to 65 mph.";
            };
        };
    }

    private static String gradeMessage(DriverGrade grade) {
        return switch (grade) {
            case A -> "Grade A - Excellent driver! Share your techniques with the team.";
            case B -> "Grade B - Good performance. Small tweaks can push you to A level.";
            case C -> "Grade C - Room for improvement. Focus on your biggest issue first.";
            case D -> "Grade D - Needs attention. Let's schedule a coaching session.";
            case F -> "Grade F - Urgent improvement needed. Contact your fleet manager.";
        };
    }

    private static String format(String template, Object... args) {
        return String.format(Locale.ROOT, template, args);
    }
}
