package com.fuelcopilot.behavior.detection;

import com.fuelcopilot.behavior.config.BehaviorThresholds;
import com.fuelcopilot.behavior.model.BehaviorType;
import com.fuelcopilot.behavior.state.VehicleBehaviorState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("FuelWasteAccountant Tests")
class FuelWasteAccountantTest {

    private final FuelWasteAccountant accountant = new FuelWasteAccountant(BehaviorThresholds.defaults());

    @Test
    @DisplayName("Should book per-event waste times the tier multiplier")
    void shouldBookPerEventWaste() {
        VehicleBehaviorState state = new VehicleBehaviorState("TRK-1", 10, 100);

        double severe = accountant.recordOccurrence(state, BehaviorType.HARD_ACCELERATION, 2.0);
        double minor = accountant.recordOccurrence(state, BehaviorType.HARD_BRAKING, 0.5);

        assertThat(severe).isCloseTo(0.10, within(1e-9));
        assertThat(minor).isCloseTo(0.01, within(1e-9));
        assertThat(state.totalFuelWaste()).isCloseTo(0.11, within(1e-9));
    }

    @Test
    @DisplayName("Should book sustained waste per minute of active time")
    void shouldBookSustainedWaste() {
        VehicleBehaviorState state = new VehicleBehaviorState("TRK-1", 10, 100);

        accountant.recordActiveTime(state, BehaviorType.WRONG_GEAR, 120, 1.0);
        accountant.recordActiveTime(state, BehaviorType.OVERSPEEDING, 60, 10.0);

        assertThat(state.fuelWaste(BehaviorType.WRONG_GEAR)).isCloseTo(0.06, within(1e-9));
        assertThat(state.fuelWaste(BehaviorType.OVERSPEEDING)).isCloseTo(0.10, within(1e-9));
    }

    @Test
    @DisplayName("Should refuse mixing per-event and per-minute categories")
    void shouldRefuseWrongRateKind() {
        assertThatThrownBy(() -> accountant.perEventGallons(BehaviorType.EXCESSIVE_RPM))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> accountant.perMinuteGallons(BehaviorType.HARD_BRAKING))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
