package com.fuelcopilot.behavior.fleet;

import java.util.Set;

/**
 * Source of the vehicles currently in service. Vehicles missing from this set
 * are dropped by the eviction sweep.
 */
public interface ActiveVehicleRegistry {

    Set<String> activeVehicleIds();
}
