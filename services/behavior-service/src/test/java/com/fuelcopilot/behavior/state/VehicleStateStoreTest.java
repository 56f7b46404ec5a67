package com.fuelcopilot.behavior.state;

import com.fuelcopilot.behavior.config.BehaviorThresholds;
import com.fuelcopilot.behavior.model.BehaviorType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("VehicleStateStore Tests")
class VehicleStateStoreTest {

    private static final Instant NOW = Instant.parse("2025-06-15T12:00:00Z");

    private VehicleStateStore store;

    @BeforeEach
    void setUp() {
        store = new VehicleStateStore(BehaviorThresholds.defaults(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("Lookup")
    class Lookup {

        @Test
        @DisplayName("Should create a record on first access and reuse it afterwards")
        void shouldCreateOnce() {
            VehicleBehaviorState first = store.getOrCreate("TRK-1");
            VehicleBehaviorState second = store.getOrCreate("TRK-1");

            assertThat(first).isSameAs(second);
            assertThat(store.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should not create a record when only reading")
        void shouldNotCreateOnRead() {
            assertThat(store.find("TRK-404")).isEmpty();
            assertThat(store.snapshot("TRK-404")).isEmpty();
            assertThat(store.size()).isZero();
        }

        @Test
        @DisplayName("Snapshot should be detached from later updates")
        void snapshotShouldBeDetached() {
            store.withVehicle("TRK-1", state -> {
                state.incrementOccurrences(BehaviorType.HARD_ACCELERATION, 2);
                state.addFuelWaste(BehaviorType.HARD_ACCELERATION, 0.1);
                return null;
            });

            VehicleStateSnapshot snapshot = store.snapshot("TRK-1").orElseThrow();
            store.withVehicle("TRK-1", state -> {
                state.incrementOccurrences(BehaviorType.HARD_ACCELERATION, 5);
                return null;
            });

            assertThat(snapshot.getHardAccelCount()).isEqualTo(2);
            assertThat(snapshot.fuelWaste(BehaviorType.HARD_ACCELERATION)).isEqualTo(0.1);
        }
    }

    @Nested
    @DisplayName("Eviction")
    class Eviction {

        @Test
        @DisplayName("Should remove exactly the vehicles missing from the active set")
        void shouldRemoveSetDifference() {
            for (String id : List.of("A", "B", "C", "D")) {
                touch(id, NOW.minusSeconds(60));
            }

            int removed = store.evict(Set.of("A", "C"), Duration.ofDays(30));

            assertThat(removed).isEqualTo(2);
            assertThat(store.trackedVehicleIds()).containsExactlyInAnyOrder("A", "C");
        }

        @Test
        @DisplayName("Should remove active vehicles that stopped reporting")
        void shouldRemoveStaleVehicles() {
            touch("FRESH", NOW.minus(Duration.ofDays(29)));
            touch("STALE", NOW.minus(Duration.ofDays(31)));

            int removed = store.evict(Set.of("FRESH", "STALE"), Duration.ofDays(30));

            assertThat(removed).isEqualTo(1);
            assertThat(store.trackedVehicleIds()).containsExactly("FRESH");
        }

        @Test
        @DisplayName("Should keep active vehicles that never reported a timestamp")
        void shouldKeepActiveWithoutTimestamp() {
            store.getOrCreate("NEW");

            assertThat(store.evict(Set.of("NEW"), Duration.ofDays(30))).isZero();
            assertThat(store.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("Update after eviction should land on a fresh record")
        void updateAfterEvictionShouldUseFreshRecord() {
            VehicleBehaviorState evicted = store.getOrCreate("GONE");
            store.evict(Set.of(), Duration.ofDays(30));

            VehicleBehaviorState used = store.withVehicle("GONE", state -> state);

            assertThat(evicted.isRetired()).isTrue();
            assertThat(used).isNotSameAs(evicted);
            assertThat(used.isRetired()).isFalse();
        }
    }

    @Test
    @DisplayName("Concurrent updates to one vehicle should not lose increments")
    void concurrentUpdatesShouldBeSerialized() throws Exception {
        int threads = 8;
        int perThread = 500;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        store.withVehicle("SHARED", state -> {
                            state.incrementOccurrences(BehaviorType.HARD_BRAKING, 1);
                            return null;
                        });
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(store.snapshot("SHARED").orElseThrow().getHardBrakeCount()).isEqualTo(threads * perThread);
    }

    private void touch(String vehicleId, Instant lastSeen) {
        store.withVehicle(vehicleId, state -> {
            state.recordLastValues(50.0, 1400, 10, lastSeen);
            return null;
        });
    }
}
