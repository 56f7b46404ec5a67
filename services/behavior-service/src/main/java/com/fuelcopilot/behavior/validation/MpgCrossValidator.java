package com.fuelcopilot.behavior.validation;

import com.fuelcopilot.behavior.config.BehaviorThresholds;
import com.fuelcopilot.behavior.model.MpgCrossValidation;
import com.fuelcopilot.behavior.state.VehicleStateSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Compares the Kalman-filtered MPG estimate against the ECU-reported fuel
 * economy over the most recent samples of each, to catch estimator drift.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MpgCrossValidator {

    private final BehaviorThresholds thresholds;
    private final Clock clock;

    /**
     * @return empty when either window holds fewer than the minimum samples or
     *         the ECU mean is effectively zero
     */
    public Optional<MpgCrossValidation> validate(VehicleStateSnapshot snapshot) {
        List<Double> kalman = snapshot.getKalmanMpgSamples();
        List<Double> ecu = snapshot.getEcuMpgSamples();
        int minSamples = thresholds.getMpgMinSamples();
        if (kalman.size() < minSamples || ecu.size() < minSamples) {
            log.debug("Not enough MPG samples to cross-validate {}: kalman={}, ecu={}",
                    snapshot.getVehicleId(), kalman.size(), ecu.size());
            return Optional.empty();
        }

        double kalmanMean = mean(kalman);
        double ecuMean = mean(ecu);
        if (ecuMean <= BehaviorThresholds.EPSILON) {
            return Optional.empty();
        }

        double differencePct = Math.abs(kalmanMean - ecuMean) / ecuMean * 100.0;
        boolean valid = differencePct <= thresholds.getMpgCrossValidationTolerancePct();

        String recommendation;
        if (valid) {
            recommendation = "MPG validated - Kalman estimate matches ECU";
        } else if (kalmanMean > ecuMean) {
            recommendation = String.format(Locale.ROOT,
                    "Kalman MPG %.1f%% higher than ECU - may be overestimating", differencePct);
        } else {
            recommendation = String.format(Locale.ROOT,
                    "Kalman MPG %.1f%% lower than ECU - may be underestimating", differencePct);
        }
        if (!valid) {
            log.warn("MPG cross-validation failed for {}: kalman={}, ecu={}, diff={}%",
                    snapshot.getVehicleId(), kalmanMean, ecuMean, differencePct);
        }

        return Optional.of(MpgCrossValidation.builder()
                .vehicleId(snapshot.getVehicleId())
                .timestamp(clock.instant())
                .kalmanMpg(kalmanMean)
                .ecuMpg(ecuMean)
                .differencePct(differencePct)
                .valid(valid)
                .recommendation(recommendation)
                .build());
    }

    private static double mean(List<Double> samples) {
        return samples.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }
}
