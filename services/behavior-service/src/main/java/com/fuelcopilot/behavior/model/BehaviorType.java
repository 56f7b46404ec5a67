package com.fuelcopilot.behavior.model;

/**
 * Driving behaviors that waste fuel. Each one owns a fuel-waste accumulator.
 */
public enum BehaviorType {
    HARD_ACCELERATION("hard_acceleration"),
    HARD_BRAKING("hard_braking"),
    EXCESSIVE_RPM("high_rpm"),
    WRONG_GEAR("wrong_gear"),
    OVERSPEEDING("overspeeding");

    private final String wasteCategory;

    BehaviorType(String wasteCategory) {
        this.wasteCategory = wasteCategory;
    }

    /**
     * Name of the fuel-waste category this behavior feeds, as shown on fleet reports
     */
    public String getWasteCategory() {
        return wasteCategory;
    }
}
