package com.fuelcopilot.behavior.config;

import com.fuelcopilot.behavior.config.properties.BehaviorProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

/**
 * Freezes the bound {@link BehaviorProperties} into the immutable
 * {@link BehaviorThresholds} shared by the detection engine.
 */
@Configuration
@Slf4j
public class BehaviorEngineConfig {

    @Bean
    public BehaviorThresholds behaviorThresholds(BehaviorProperties properties) {
        BehaviorThresholds thresholds = toThresholds(properties).validate();
        log.info("Behavior thresholds loaded: accel={}/{}/{} mph/s, rpm excessive={} redline={}, speed warning={} mph, "
                        + "MPG tolerance={}%",
                thresholds.getAccelMinorThreshold(), thresholds.getAccelModerateThreshold(),
                thresholds.getAccelSevereThreshold(), thresholds.getRpmExcessive(), thresholds.getRpmRedline(),
                thresholds.getSpeedWarning(), thresholds.getMpgCrossValidationTolerancePct());
        return thresholds;
    }

    static BehaviorThresholds toThresholds(BehaviorProperties properties) {
        BehaviorProperties.Acceleration accel = properties.getAcceleration();
        BehaviorProperties.Braking brake = properties.getBraking();
        BehaviorProperties.Rpm rpm = properties.getRpm();
        BehaviorProperties.WrongGear gear = properties.getWrongGear();
        BehaviorProperties.Speed speed = properties.getSpeed();
        BehaviorProperties.FuelWaste waste = properties.getFuelWaste();
        BehaviorProperties.Device device = properties.getDevice();
        BehaviorProperties.Ingestion ingestion = properties.getIngestion();
        BehaviorProperties.CrossValidation crossValidation = properties.getCrossValidation();

        return BehaviorThresholds.builder()
                .accelMinorThreshold(accel.getMinor())
                .accelModerateThreshold(accel.getModerate())
                .accelSevereThreshold(accel.getSevere())
                .brakeMinorThreshold(brake.getMinor())
                .brakeModerateThreshold(brake.getModerate())
                .brakeSevereThreshold(brake.getSevere())
                .rpmOptimalMin(rpm.getOptimalMin())
                .rpmOptimalMax(rpm.getOptimalMax())
                .rpmHighWarning(rpm.getHighWarning())
                .rpmExcessive(rpm.getExcessive())
                .rpmRedline(rpm.getRedline())
                .rpmMinDurationSec(rpm.getMinDurationSeconds())
                .rpmCriticalDurationSec(rpm.getCriticalDurationSeconds())
                .wrongGearRpmThreshold(gear.getRpmThreshold())
                .wrongGearMinDurationSec(gear.getMinDurationSeconds())
                .wrongGearMinSpeedMph(gear.getMinSpeedMph())
                .defaultMaxGear(gear.getDefaultMaxGear())
                .maxGearByVehicleType(Map.copyOf(gear.getMaxGearByVehicleType()))
                .speedWarning(speed.getWarning())
                .speedExcessive(speed.getExcessive())
                .speedSevere(speed.getSevere())
                .overspeedingMinDurationSec(speed.getMinDurationSeconds())
                .overspeedingBaselineMph(speed.getFuelWasteBaselineMph())
                .fuelWasteHardAccelGal(waste.getHardAccelGallons())
                .fuelWasteHardBrakeGal(waste.getHardBrakeGallons())
                .fuelWasteHighRpmGalPerMin(waste.getHighRpmGallonsPerMinute())
                .fuelWasteWrongGearGalPerMin(waste.getWrongGearGallonsPerMinute())
                .fuelWasteOverspeedingGalPerMin(waste.getOverspeedingGallonsPerMinute())
                .deviceHarshAccelMg(device.getHarshAccelMilliG())
                .deviceHarshBrakeMg(device.getHarshBrakeMilliG())
                .minSampleIntervalSec(ingestion.getMinSampleIntervalSeconds())
                .maxSampleGapSec(ingestion.getMaxSampleGapSeconds())
                .eventLogCapacity(ingestion.getEventLogCapacity())
                .mpgWindowCapacity(crossValidation.getWindowCapacity())
                .mpgMinSamples(crossValidation.getMinSamples())
                .mpgCrossValidationTolerancePct(crossValidation.getTolerancePercent())
                .build();
    }
}
