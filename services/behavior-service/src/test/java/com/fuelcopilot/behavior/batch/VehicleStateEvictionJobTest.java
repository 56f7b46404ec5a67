package com.fuelcopilot.behavior.batch;

import com.fuelcopilot.behavior.config.properties.BehaviorProperties;
import com.fuelcopilot.behavior.engine.DriverBehaviorEngine;
import com.fuelcopilot.behavior.fleet.ActiveVehicleRegistry;
import com.fuelcopilot.behavior.metrics.BehaviorMetricsService;
import com.fuelcopilot.behavior.state.VehicleStateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;

import java.time.Duration;
import java.util.Set;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anySet;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit Tests for VehicleStateEvictionJob
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("VehicleStateEvictionJob Unit Tests")
class VehicleStateEvictionJobTest {

    @Mock
    private DriverBehaviorEngine engine;

    @Mock
    private VehicleStateStore stateStore;

    @Mock
    private ObjectProvider<ActiveVehicleRegistry> registryProvider;

    @Mock
    private ActiveVehicleRegistry registry;

    @Mock
    private BehaviorMetricsService metricsService;

    private BehaviorProperties properties;
    private VehicleStateEvictionJob job;

    @BeforeEach
    void setUp() {
        properties = new BehaviorProperties();
        properties.getEviction().setMaxInactive(Duration.ofDays(7));
        job = new VehicleStateEvictionJob(engine, stateStore, registryProvider, properties, metricsService);
    }

    @Test
    @DisplayName("Should evict against the registry's active vehicles")
    void shouldUseRegistry() {
        // Given
        when(registryProvider.getIfAvailable()).thenReturn(registry);
        when(registry.activeVehicleIds()).thenReturn(Set.of("TRK-1", "TRK-2"));

        // When
        job.evictInactiveVehicles();

        // Then
        verify(engine).evictInactive(Set.of("TRK-1", "TRK-2"), Duration.ofDays(7));
        verifyNoInteractions(stateStore);
    }

    @Test
    @DisplayName("Without a registry only the inactivity window should apply")
    void shouldFallBackToTrackedVehicles() {
        when(registryProvider.getIfAvailable()).thenReturn(null);
        when(stateStore.trackedVehicleIds()).thenReturn(Set.of("TRK-9"));

        job.evictInactiveVehicles();

        verify(engine).evictInactive(Set.of("TRK-9"), Duration.ofDays(7));
    }

    @Test
    @DisplayName("Should do nothing when eviction is disabled")
    void shouldSkipWhenDisabled() {
        properties.getEviction().setEnabled(false);

        job.evictInactiveVehicles();

        verifyNoInteractions(engine, registryProvider, metricsService);
    }

    @Test
    @DisplayName("A failing sweep should be counted, not propagated")
    void shouldRecordFailure() {
        when(registryProvider.getIfAvailable()).thenReturn(registry);
        when(registry.activeVehicleIds()).thenThrow(new IllegalStateException("registry unavailable"));

        job.evictInactiveVehicles();

        verify(metricsService).recordEvictionFailure();
        verify(engine, never()).evictInactive(anySet(), any());
    }
}
