package com.example.parking.model;

/**
 * Point-in-time counters of a lot. Collected floor by floor, so a snapshot taken
 * while a release is in flight may count a spot as occupied after its ticket is gone.
 */
public record DisplayBoard(String lotUid, int floors, int totalSpots, int freeSpots, int parkedVehicles) {
}
