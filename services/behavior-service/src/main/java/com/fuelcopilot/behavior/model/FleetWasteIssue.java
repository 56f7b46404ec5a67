package com.fuelcopilot.behavior.model;

import lombok.Builder;
import lombok.Value;

/**
 * The fuel-waste category that cost the fleet the most
 */
@Value
@Builder
public class FleetWasteIssue {

    BehaviorType category;
    double gallons;
}
