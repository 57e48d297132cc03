package com.example.parking.model;

/**
 * Immutable vehicle description. The plate is expected to be unique per physical
 * vehicle, nothing here enforces it.
 */
public record Vehicle(VehicleType type, String model, String licensePlate) {
}
