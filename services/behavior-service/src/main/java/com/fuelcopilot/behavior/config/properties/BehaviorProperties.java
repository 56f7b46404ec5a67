package com.fuelcopilot.behavior.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Driver behavior configuration (behavior.*)
 *
 * <p>Bound from application.yml and converted once into the immutable
 * {@link com.fuelcopilot.behavior.config.BehaviorThresholds} used at runtime.
 * Defaults match a class 8 diesel tractor.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "behavior")
public class BehaviorProperties {

    @Valid
    private Acceleration acceleration = new Acceleration();

    @Valid
    private Braking braking = new Braking();

    @Valid
    private Rpm rpm = new Rpm();

    @Valid
    private WrongGear wrongGear = new WrongGear();

    @Valid
    private Speed speed = new Speed();

    @Valid
    private FuelWaste fuelWaste = new FuelWaste();

    @Valid
    private Device device = new Device();

    @Valid
    private Ingestion ingestion = new Ingestion();

    @Valid
    private CrossValidation crossValidation = new CrossValidation();

    @Valid
    private Eviction eviction = new Eviction();

    @Valid
    private Fleet fleet = new Fleet();

    @Data
    public static class Acceleration {
        /**
         * mph per second
         */
        @Positive
        private double minor = 3.0;
        @Positive
        private double moderate = 4.5;
        @Positive
        private double severe = 6.0;
    }

    @Data
    public static class Braking {
        /**
         * Negative mph per second
         */
        @DecimalMax("0.0")
        private double minor = -4.0;
        @DecimalMax("0.0")
        private double moderate = -6.0;
        @DecimalMax("0.0")
        private double severe = -8.0;
    }

    @Data
    public static class Rpm {
        @Positive
        private int optimalMin = 1200;
        @Positive
        private int optimalMax = 1600;
        @Positive
        private int highWarning = 1800;
        @Positive
        private int excessive = 2100;
        @Positive
        private int redline = 2500;
        /**
         * Sustained seconds before a moderate/severe event
         */
        @Positive
        private double minDurationSeconds = 5.0;
        /**
         * Sustained seconds at or above redline before a critical event
         */
        @Positive
        private double criticalDurationSeconds = 10.0;
    }

    @Data
    public static class WrongGear {
        @Positive
        private int rpmThreshold = 1700;
        @Positive
        private double minDurationSeconds = 5.0;
        /**
         * Below this speed a vehicle is considered launching from a stop
         */
        @PositiveOrZero
        private double minSpeedMph = 25.0;
        @Min(1)
        private int defaultMaxGear = 13;
        /**
         * Highest gear per vehicle type, e.g. "10-speed": 10
         */
        @NotNull
        private Map<String, Integer> maxGearByVehicleType = new HashMap<>();
    }

    @Data
    public static class Speed {
        @Positive
        private double warning = 65.0;
        @Positive
        private double excessive = 70.0;
        @Positive
        private double severe = 75.0;
        @Positive
        private double minDurationSeconds = 60.0;
        /**
         * Speed above which every extra mph adds overspeeding waste
         */
        @PositiveOrZero
        private double fuelWasteBaselineMph = 65.0;
    }

    @Data
    public static class FuelWaste {
        @PositiveOrZero
        private double hardAccelGallons = 0.05;
        @PositiveOrZero
        private double hardBrakeGallons = 0.02;
        @PositiveOrZero
        private double highRpmGallonsPerMinute = 0.02;
        @PositiveOrZero
        private double wrongGearGallonsPerMinute = 0.03;
        /**
         * Per mph above the baseline speed
         */
        @PositiveOrZero
        private double overspeedingGallonsPerMinute = 0.01;
    }

    @Data
    public static class Device {
        @Positive
        private double harshAccelMilliG = 280.0;
        @Positive
        private double harshBrakeMilliG = 320.0;
    }

    @Data
    public static class Ingestion {
        /**
         * Samples closer than this are treated as duplicates
         */
        @Positive
        private double minSampleIntervalSeconds = 1.0;
        /**
         * Samples further apart than this are treated as a data gap
         */
        @Positive
        private double maxSampleGapSeconds = 300.0;
        @Min(1)
        private int eventLogCapacity = 1000;
    }

    @Data
    public static class CrossValidation {
        @Min(1)
        @Max(1000)
        private int windowCapacity = 10;
        @Min(1)
        private int minSamples = 5;
        @DecimalMin("0.0")
        private double tolerancePercent = 15.0;
    }

    @Data
    public static class Eviction {
        private boolean enabled = true;
        @NotNull
        private Duration maxInactive = Duration.ofDays(30);
        @NotNull
        private Duration interval = Duration.ofHours(1);
    }

    @Data
    public static class Fleet {
        @Min(1)
        private int performerCount = 3;
        @Positive
        private double scoringPeriodHours = 24.0;
        @Min(1)
        private int maxCoachingTips = 5;
    }
}
