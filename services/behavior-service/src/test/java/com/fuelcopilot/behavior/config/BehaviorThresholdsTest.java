package com.fuelcopilot.behavior.config;

import com.fuelcopilot.behavior.exception.BehaviorConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("BehaviorThresholds Tests")
class BehaviorThresholdsTest {

    @Test
    @DisplayName("Defaults should describe a class 8 diesel and pass validation")
    void defaultsShouldBeValid() {
        BehaviorThresholds thresholds = BehaviorThresholds.defaults().validate();

        assertThat(thresholds.getAccelSevereThreshold()).isEqualTo(6.0);
        assertThat(thresholds.getBrakeSevereThreshold()).isEqualTo(-8.0);
        assertThat(thresholds.getRpmRedline()).isEqualTo(2500);
        assertThat(thresholds.getSpeedWarning()).isEqualTo(65.0);
        assertThat(thresholds.getMpgCrossValidationTolerancePct()).isEqualTo(15.0);
    }

    @Test
    @DisplayName("Should resolve max gear per vehicle type with a default fallback")
    void shouldResolveMaxGear() {
        BehaviorThresholds thresholds = BehaviorThresholds.defaults().toBuilder()
                .maxGearByVehicleType(Map.of("10-speed", 10))
                .build();

        assertThat(thresholds.maxGearFor("10-speed")).isEqualTo(10);
        assertThat(thresholds.maxGearFor("18-speed")).isEqualTo(13);
        assertThat(thresholds.maxGearFor(null)).isEqualTo(13);
    }

    @Test
    @DisplayName("Should reject acceleration tiers out of order")
    void shouldRejectUnorderedAccelerationTiers() {
        BehaviorThresholds thresholds = BehaviorThresholds.defaults().toBuilder()
                .accelModerateThreshold(7.0)
                .build();

        assertThatThrownBy(thresholds::validate)
                .isInstanceOf(BehaviorConfigurationException.class)
                .hasMessageContaining("acceleration");
    }

    @Test
    @DisplayName("Should reject braking tiers that do not grow more negative")
    void shouldRejectUnorderedBrakingTiers() {
        BehaviorThresholds thresholds = BehaviorThresholds.defaults().toBuilder()
                .brakeSevereThreshold(-5.0)
                .build();

        assertThatThrownBy(thresholds::validate)
                .isInstanceOf(BehaviorConfigurationException.class)
                .hasMessageContaining("braking");
    }

    @Test
    @DisplayName("Should reject a gap policy whose max gap is below the min interval")
    void shouldRejectInvertedGapPolicy() {
        BehaviorThresholds thresholds = BehaviorThresholds.defaults().toBuilder()
                .minSampleIntervalSec(10)
                .maxSampleGapSec(5)
                .build();

        assertThatThrownBy(thresholds::validate).isInstanceOf(BehaviorConfigurationException.class);
    }

    @Test
    @DisplayName("Should reject an MPG minimum larger than the window")
    void shouldRejectOversizedMpgMinimum() {
        BehaviorThresholds thresholds = BehaviorThresholds.defaults().toBuilder()
                .mpgMinSamples(11)
                .build();

        assertThatThrownBy(thresholds::validate).isInstanceOf(BehaviorConfigurationException.class);
    }
}
