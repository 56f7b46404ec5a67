package com.fuelcopilot.behavior.state;

import com.fuelcopilot.behavior.config.BehaviorThresholds;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Keyed store of per-vehicle behavior records.
 *
 * <p>Each record carries its own lock, so samples for different vehicles are
 * processed in parallel while samples for the same vehicle are serialized.
 * Eviction is the only operation that removes records; it locks one vehicle at
 * a time and never blocks ingestion for the others.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VehicleStateStore {

    private final Map<String, VehicleBehaviorState> states = new ConcurrentHashMap<>();

    private final BehaviorThresholds thresholds;
    private final Clock clock;

    /**
     * Returns the vehicle's record, creating it on first access. Never fails.
     */
    public VehicleBehaviorState getOrCreate(String vehicleId) {
        return states.computeIfAbsent(vehicleId, this::newState);
    }

    public Optional<VehicleBehaviorState> find(String vehicleId) {
        return Optional.ofNullable(states.get(vehicleId));
    }

    /**
     * Runs {@code action} against the vehicle's record while holding its lock,
     * creating the record if needed. Retries if the record was evicted between
     * lookup and lock acquisition.
     */
    public <T> T withVehicle(String vehicleId, Function<VehicleBehaviorState, T> action) {
        while (true) {
            VehicleBehaviorState state = getOrCreate(vehicleId);
            ReentrantLock lock = state.getLock();
            lock.lock();
            try {
                if (!state.isRetired()) {
                    return action.apply(state);
                }
            } finally {
                lock.unlock();
            }
        }
    }

    /**
     * Runs {@code action} against every live record, one vehicle lock at a time.
     */
    public void forEachVehicle(Consumer<VehicleBehaviorState> action) {
        for (VehicleBehaviorState state : states.values()) {
            ReentrantLock lock = state.getLock();
            lock.lock();
            try {
                if (!state.isRetired()) {
                    action.accept(state);
                }
            } finally {
                lock.unlock();
            }
        }
    }

    public Optional<VehicleStateSnapshot> snapshot(String vehicleId) {
        VehicleBehaviorState state = states.get(vehicleId);
        if (state == null) {
            return Optional.empty();
        }
        ReentrantLock lock = state.getLock();
        lock.lock();
        try {
            return state.isRetired() ? Optional.empty() : Optional.of(state.snapshot());
        } finally {
            lock.unlock();
        }
    }

    public List<VehicleStateSnapshot> snapshotAll() {
        List<VehicleStateSnapshot> snapshots = new ArrayList<>(states.size());
        forEachVehicle(state -> snapshots.add(state.snapshot()));
        return snapshots;
    }

    /**
     * Removes every vehicle that is either absent from {@code activeVehicleIds}
     * or has not reported within {@code maxInactive}. Records are removed whole.
     *
     * @return number of vehicles removed
     */
    public int evict(Set<String> activeVehicleIds, Duration maxInactive) {
        Instant cutoff = clock.instant().minus(maxInactive);
        int removed = 0;

        for (Map.Entry<String, VehicleBehaviorState> entry : states.entrySet()) {
            String vehicleId = entry.getKey();
            VehicleBehaviorState state = entry.getValue();
            ReentrantLock lock = state.getLock();
            lock.lock();
            try {
                if (state.isRetired() || !shouldEvict(state, activeVehicleIds, cutoff)) {
                    continue;
                }
                state.setRetired(true);
                if (states.remove(vehicleId, state)) {
                    removed++;
                    log.info("Evicted behavior state for inactive vehicle: {} (last seen {})",
                            vehicleId, state.getLastTimestamp());
                }
            } finally {
                lock.unlock();
            }
        }
        return removed;
    }

    public Set<String> trackedVehicleIds() {
        return Set.copyOf(states.keySet());
    }

    public int size() {
        return states.size();
    }

    private static boolean shouldEvict(VehicleBehaviorState state, Set<String> activeVehicleIds, Instant cutoff) {
        if (!activeVehicleIds.contains(state.getVehicleId())) {
            return true;
        }
        Instant lastSeen = state.getLastTimestamp();
        return lastSeen != null && lastSeen.isBefore(cutoff);
    }

    private VehicleBehaviorState newState(String vehicleId) {
        log.debug("Tracking new vehicle: {}", vehicleId);
        return new VehicleBehaviorState(vehicleId, thresholds.getMpgWindowCapacity(), thresholds.getEventLogCapacity());
    }
}
