package com.example.parking.model;

import com.example.parking.service.exception.IncompatibleSpotException;
import com.example.parking.service.exception.SpotOccupiedException;
import lombok.AccessLevel;
import lombok.Getter;

import java.util.Optional;

/**
 * Smallest allocatable unit. Not thread-safe on its own: once a spot is added to a
 * {@link ParkingFloor}, every read and write goes through the floor's spot lock.
 */
@Getter
public class ParkingSpot {

    private final String id;
    private final SpotType type;
    private boolean free;
    @Getter(AccessLevel.NONE)
    private Vehicle vehicle;

    /**
     * A spot created non-free has no occupant; it is withheld from allocation until
     * {@link #vacate()} is called on it.
     */
    public ParkingSpot(String id, boolean free, SpotType type) {
        this.id = id;
        this.free = free;
        this.type = type;
    }

    public boolean isCompatible(VehicleType vehicleType) {
        return type.accepts(vehicleType);
    }

    public void occupy(Vehicle vehicle) {
        if (!free) {
            throw new SpotOccupiedException(id);
        }
        if (!isCompatible(vehicle.type())) {
            throw new IncompatibleSpotException(vehicle.type(), type);
        }
        this.vehicle = vehicle;
        this.free = false;
    }

    public void vacate() {
        this.vehicle = null;
        this.free = true;
    }

    public Optional<Vehicle> getOccupant() {
        return Optional.ofNullable(vehicle);
    }

    ParkingSpot snapshot() {
        ParkingSpot copy = new ParkingSpot(id, free, type);
        copy.vehicle = vehicle;
        return copy;
    }

    boolean isAvailableFor(VehicleType vehicleType) {
        return free && isCompatible(vehicleType);
    }
}
