package com.example.parking.service;

import com.example.parking.model.Vehicle;

import java.util.Optional;

/**
 * Associates an owner with the vehicles they may bring to a lot. The lot itself never
 * consults an account.
 */
public interface VehicleAccount {

    /** @return the id the vehicle is registered under */
    String registerVehicle(Vehicle vehicle);

    void removeVehicle(Vehicle vehicle);

    Optional<Vehicle> getVehicleById(String vehicleId);
}
