package com.fuelcopilot.behavior.state;

import com.fuelcopilot.behavior.model.BehaviorEvent;
import com.fuelcopilot.behavior.model.BehaviorType;
import com.fuelcopilot.behavior.model.SeverityLevel;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutable behavior record for a single vehicle, owned by {@link VehicleStateStore}.
 *
 * <p>Every read and write happens while holding {@link #getLock()}.
 */
@Getter
@Setter
public class VehicleBehaviorState {

    @Setter(AccessLevel.NONE)
    private final String vehicleId;

    @Getter(AccessLevel.PACKAGE)
    @Setter(AccessLevel.NONE)
    private final ReentrantLock lock = new ReentrantLock();

    // Previous reading, for delta calculation
    private Double lastSpeed;
    private Integer lastRpm;
    private Integer lastGear;
    private Instant lastTimestamp;

    // Sustained conditions; set only while the condition holds
    private Instant highRpmStart;
    private Instant wrongGearStart;
    private Instant overspeedingStart;

    // Highest severity already reported for each open condition
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private final Map<BehaviorType, SeverityLevel> reportedSeverity = new EnumMap<>(BehaviorType.class);

    // Counters for scoring
    private int hardAccelCount;
    private int hardBrakeCount;
    private double highRpmSeconds;
    private double wrongGearSeconds;
    private double overspeedingSeconds;

    @Setter(AccessLevel.NONE)
    private final Map<BehaviorType, Double> fuelWaste = new EnumMap<>(BehaviorType.class);

    @Setter(AccessLevel.NONE)
    private final RingBuffer<BehaviorEvent> events;

    @Setter(AccessLevel.NONE)
    private final RingBuffer<Double> kalmanMpgSamples;

    @Setter(AccessLevel.NONE)
    private final RingBuffer<Double> ecuMpgSamples;

    // UTC epoch day of the last daily reset applied to this record
    private long lastResetEpochDay = Long.MIN_VALUE;

    // Set once the record has been evicted from the store
    @Setter(AccessLevel.PACKAGE)
    private boolean retired;

    public VehicleBehaviorState(String vehicleId, int mpgWindowCapacity, int eventLogCapacity) {
        this.vehicleId = vehicleId;
        this.kalmanMpgSamples = new RingBuffer<>(mpgWindowCapacity);
        this.ecuMpgSamples = new RingBuffer<>(mpgWindowCapacity);
        this.events = new RingBuffer<>(eventLogCapacity);
        for (BehaviorType type : BehaviorType.values()) {
            fuelWaste.put(type, 0.0);
        }
    }

    public void addFuelWaste(BehaviorType type, double gallons) {
        fuelWaste.merge(type, gallons, Double::sum);
    }

    public double fuelWaste(BehaviorType type) {
        return fuelWaste.get(type);
    }

    public double totalFuelWaste() {
        return fuelWaste.values().stream().mapToDouble(Double::doubleValue).sum();
    }

    public void incrementOccurrences(BehaviorType type, int count) {
        switch (type) {
            case HARD_ACCELERATION -> hardAccelCount += count;
            case HARD_BRAKING -> hardBrakeCount += count;
            case EXCESSIVE_RPM, WRONG_GEAR, OVERSPEEDING ->
                    throw new IllegalArgumentException(type + " is tracked by duration, not occurrences");
        }
    }

    public Instant conditionStart(BehaviorType type) {
        return switch (type) {
            case EXCESSIVE_RPM -> highRpmStart;
            case WRONG_GEAR -> wrongGearStart;
            case OVERSPEEDING -> overspeedingStart;
            case HARD_ACCELERATION, HARD_BRAKING -> null;
        };
    }

    public void setConditionStart(BehaviorType type, Instant start) {
        switch (type) {
            case EXCESSIVE_RPM -> highRpmStart = start;
            case WRONG_GEAR -> wrongGearStart = start;
            case OVERSPEEDING -> overspeedingStart = start;
            case HARD_ACCELERATION, HARD_BRAKING ->
                    throw new IllegalArgumentException(type + " is not a sustained condition");
        }
    }

    public SeverityLevel reportedSeverity(BehaviorType type) {
        return reportedSeverity.get(type);
    }

    public void markReported(BehaviorType type, SeverityLevel severity) {
        reportedSeverity.put(type, severity);
    }

    /**
     * Closes a sustained condition: the next activation starts from zero duration.
     * Accumulated seconds and fuel waste are kept.
     */
    public void endCondition(BehaviorType type) {
        setConditionStart(type, null);
        reportedSeverity.remove(type);
    }

    public void addConditionSeconds(BehaviorType type, double seconds) {
        switch (type) {
            case EXCESSIVE_RPM -> highRpmSeconds += seconds;
            case WRONG_GEAR -> wrongGearSeconds += seconds;
            case OVERSPEEDING -> overspeedingSeconds += seconds;
            case HARD_ACCELERATION, HARD_BRAKING ->
                    throw new IllegalArgumentException(type + " is not a sustained condition");
        }
    }

    public void recordLastValues(Double speed, Integer rpm, Integer gear, Instant timestamp) {
        this.lastSpeed = speed;
        this.lastRpm = rpm;
        this.lastGear = gear;
        this.lastTimestamp = timestamp;
    }

    /**
     * Zero the scoring-day accumulators. Last values, open conditions and MPG
     * windows survive the reset.
     */
    public void resetDaily(long epochDay) {
        hardAccelCount = 0;
        hardBrakeCount = 0;
        highRpmSeconds = 0.0;
        wrongGearSeconds = 0.0;
        overspeedingSeconds = 0.0;
        for (BehaviorType type : BehaviorType.values()) {
            fuelWaste.put(type, 0.0);
        }
        events.clear();
        lastResetEpochDay = epochDay;
    }

    public VehicleStateSnapshot snapshot() {
        return VehicleStateSnapshot.builder()
                .vehicleId(vehicleId)
                .lastSpeed(lastSpeed)
                .lastRpm(lastRpm)
                .lastGear(lastGear)
                .lastTimestamp(lastTimestamp)
                .highRpmActive(highRpmStart != null)
                .wrongGearActive(wrongGearStart != null)
                .overspeedingActive(overspeedingStart != null)
                .hardAccelCount(hardAccelCount)
                .hardBrakeCount(hardBrakeCount)
                .highRpmSeconds(highRpmSeconds)
                .wrongGearSeconds(wrongGearSeconds)
                .overspeedingSeconds(overspeedingSeconds)
                .fuelWaste(new EnumMap<>(fuelWaste))
                .events(events.toList())
                .kalmanMpgSamples(kalmanMpgSamples.toList())
                .ecuMpgSamples(ecuMpgSamples.toList())
                .build();
    }
}
