package com.fuelcopilot.behavior.state;

import com.fuelcopilot.behavior.model.BehaviorEvent;
import com.fuelcopilot.behavior.model.BehaviorType;
import com.fuelcopilot.behavior.model.SeverityLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("VehicleBehaviorState Tests")
class VehicleBehaviorStateTest {

    private static final Instant T0 = Instant.parse("2025-06-15T10:00:00Z");

    @Test
    @DisplayName("Daily reset should zero accumulators but keep last values, open conditions and MPG windows")
    void dailyResetShouldKeepContinuityFields() {
        // Given
        VehicleBehaviorState state = new VehicleBehaviorState("TRK-1", 10, 100);
        state.incrementOccurrences(BehaviorType.HARD_ACCELERATION, 3);
        state.incrementOccurrences(BehaviorType.HARD_BRAKING, 2);
        state.addConditionSeconds(BehaviorType.EXCESSIVE_RPM, 30);
        state.addConditionSeconds(BehaviorType.OVERSPEEDING, 90);
        state.addFuelWaste(BehaviorType.WRONG_GEAR, 0.4);
        state.setConditionStart(BehaviorType.EXCESSIVE_RPM, T0);
        state.getKalmanMpgSamples().add(6.5);
        state.getEvents().add(BehaviorEvent.builder()
                .vehicleId("TRK-1")
                .timestamp(T0)
                .behaviorType(BehaviorType.HARD_BRAKING)
                .severity(SeverityLevel.MINOR)
                .build());
        state.recordLastValues(55.0, 1500, 10, T0);

        // When
        state.resetDaily(20_000L);

        // Then
        assertThat(state.getHardAccelCount()).isZero();
        assertThat(state.getHardBrakeCount()).isZero();
        assertThat(state.getHighRpmSeconds()).isZero();
        assertThat(state.getOverspeedingSeconds()).isZero();
        assertThat(state.totalFuelWaste()).isZero();
        assertThat(state.getEvents().isEmpty()).isTrue();
        assertThat(state.getLastResetEpochDay()).isEqualTo(20_000L);

        assertThat(state.getLastSpeed()).isEqualTo(55.0);
        assertThat(state.getLastTimestamp()).isEqualTo(T0);
        assertThat(state.getHighRpmStart()).isEqualTo(T0);
        assertThat(state.getKalmanMpgSamples().toList()).containsExactly(6.5);
    }

    @Test
    @DisplayName("Ending a condition should forget its start and reported severity only")
    void endConditionShouldKeepTotals() {
        VehicleBehaviorState state = new VehicleBehaviorState("TRK-1", 10, 100);
        state.setConditionStart(BehaviorType.WRONG_GEAR, T0);
        state.markReported(BehaviorType.WRONG_GEAR, SeverityLevel.MODERATE);
        state.addConditionSeconds(BehaviorType.WRONG_GEAR, 12);

        state.endCondition(BehaviorType.WRONG_GEAR);

        assertThat(state.conditionStart(BehaviorType.WRONG_GEAR)).isNull();
        assertThat(state.reportedSeverity(BehaviorType.WRONG_GEAR)).isNull();
        assertThat(state.getWrongGearSeconds()).isEqualTo(12.0);
    }

    @Test
    @DisplayName("Should reject occurrence counts for duration-based behaviors")
    void shouldRejectOccurrencesForSustainedTypes() {
        VehicleBehaviorState state = new VehicleBehaviorState("TRK-1", 10, 100);

        assertThatThrownBy(() -> state.incrementOccurrences(BehaviorType.OVERSPEEDING, 1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
