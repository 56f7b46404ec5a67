package com.fuelcopilot.behavior.batch;

import com.fuelcopilot.behavior.config.properties.BehaviorProperties;
import com.fuelcopilot.behavior.engine.DriverBehaviorEngine;
import com.fuelcopilot.behavior.fleet.ActiveVehicleRegistry;
import com.fuelcopilot.behavior.metrics.BehaviorMetricsService;
import com.fuelcopilot.behavior.state.VehicleStateStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Set;

/**
 * Vehicle State Eviction Job
 *
 * Periodically drops behavior state for vehicles that left the fleet or have
 * not reported for {@code behavior.eviction.max-inactive} (30 days by default).
 *
 * Active vehicles come from an {@link ActiveVehicleRegistry} bean when one is
 * present. Without a registry every tracked vehicle counts as active, so only
 * the inactivity window applies.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class VehicleStateEvictionJob {

    private final DriverBehaviorEngine engine;
    private final VehicleStateStore stateStore;
    private final ObjectProvider<ActiveVehicleRegistry> activeVehicleRegistry;
    private final BehaviorProperties properties;
    private final BehaviorMetricsService metricsService;

    @Scheduled(
            fixedDelayString = "${behavior.eviction.interval:PT1H}",
            initialDelayString = "${behavior.eviction.interval:PT1H}")
    public void evictInactiveVehicles() {
        BehaviorProperties.Eviction eviction = properties.getEviction();
        if (!eviction.isEnabled()) {
            log.debug("Vehicle state eviction disabled");
            return;
        }

        try {
            Duration maxInactive = eviction.getMaxInactive();
            Set<String> activeIds = resolveActiveVehicleIds();
            int removed = engine.evictInactive(activeIds, maxInactive);
            log.info("Vehicle state eviction completed: removed={}, active={}, maxInactive={}",
                    removed, activeIds.size(), maxInactive);
        } catch (Exception e) {
            metricsService.recordEvictionFailure();
            log.error("Vehicle state eviction failed", e);
        }
    }

    private Set<String> resolveActiveVehicleIds() {
        ActiveVehicleRegistry registry = activeVehicleRegistry.getIfAvailable();
        if (registry == null) {
            return stateStore.trackedVehicleIds();
        }
        return registry.activeVehicleIds();
    }
}
