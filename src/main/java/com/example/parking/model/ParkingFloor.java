package com.example.parking.model;

import com.example.parking.service.exception.SpotOccupiedException;
import com.example.parking.service.util.IdSequence;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * A floor owns its spots exclusively. The spot table is guarded by a single lock held
 * only for the duration of one method; callers that also hold the lot's floor-table
 * lock must take it first.
 */
@Slf4j
public class ParkingFloor {

    public static final int DEFAULT_SPOT_COUNT = 10;

    @Getter
    private final int id;

    private final IdSequence spotIds;
    private final Map<String, ParkingSpot> spots = new LinkedHashMap<>();
    private final ReentrantLock spotsLock = new ReentrantLock();

    public ParkingFloor(int id) {
        this(id, DEFAULT_SPOT_COUNT);
    }

    public ParkingFloor(int id, int defaultSpotCount) {
        this(id, new IdSequence("spot_" + id + "_"), defaultSpotCount);
    }

    public ParkingFloor(int id, IdSequence spotIds, int defaultSpotCount) {
        this.id = id;
        this.spotIds = spotIds;
        for (int i = 0; i < defaultSpotCount; i++) {
            addSpot(SpotType.REGULAR);
        }
    }

    /** Inserts under the spot's id; an existing spot with the same id is replaced. */
    public void addSpot(ParkingSpot spot) {
        ParkingSpot replaced = withSpots(table -> table.put(spot.getId(), spot));
        if (replaced != null) {
            log.debug("Spot {} on floor {} replaced", spot.getId(), id);
        }
    }

    /** @return id of the new spot */
    public String addSpot(SpotType type) {
        ParkingSpot spot = new ParkingSpot(spotIds.next(), true, type);
        addSpot(spot);
        return spot.getId();
    }

    /** First fit in insertion order. */
    public Optional<String> findAvailableSpot(VehicleType vehicleType) {
        return withSpots(table -> table.values().stream()
                .filter(spot -> spot.isAvailableFor(vehicleType))
                .map(ParkingSpot::getId)
                .findFirst());
    }

    /** Free or occupied, any spot whose type admits the vehicle type. */
    public boolean hasCompatibleSpot(VehicleType vehicleType) {
        return withSpots(table -> table.values().stream().anyMatch(spot -> spot.isCompatible(vehicleType)));
    }

    /**
     * Re-validates and occupies under the spot lock. A spot that vanished since the
     * scan is reported the same way as one taken by a concurrent allocation.
     */
    public void occupySpot(String spotId, Vehicle vehicle) {
        withSpots(table -> {
            ParkingSpot spot = table.get(spotId);
            if (spot == null) {
                throw new SpotOccupiedException(spotId);
            }
            spot.occupy(vehicle);
            return spot;
        });
    }

    /** @return false if this floor has no spot with the given id */
    public boolean vacateSpot(String spotId) {
        return withSpots(table -> {
            ParkingSpot spot = table.get(spotId);
            if (spot == null) {
                return false;
            }
            spot.vacate();
            return true;
        });
    }

    /** Detached copy; changing it does not affect the floor. */
    public Optional<ParkingSpot> getSpot(String spotId) {
        return withSpots(table -> Optional.ofNullable(table.get(spotId)).map(ParkingSpot::snapshot));
    }

    public int getSpotCount() {
        return withSpots(Map::size);
    }

    public int getFreeSpotCount() {
        return withSpots(table -> (int) table.values().stream().filter(ParkingSpot::isFree).count());
    }

    public int getOccupiedSpotCount() {
        return withSpots(table -> (int) table.values().stream().filter(spot -> !spot.isFree()).count());
    }

    private <T> T withSpots(Function<Map<String, ParkingSpot>, T> action) {
        spotsLock.lock();
        try {
            return action.apply(spots);
        } finally {
            spotsLock.unlock();
        }
    }
}
