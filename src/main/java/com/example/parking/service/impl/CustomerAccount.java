package com.example.parking.service.impl;

import com.example.parking.model.Vehicle;
import com.example.parking.service.VehicleAccount;
import com.example.parking.service.util.IdSequence;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@Slf4j
public class CustomerAccount implements VehicleAccount {

    @Getter
    private final String name;

    @Getter
    private final String phone;

    private final IdSequence vehicleIds = new IdSequence("veh_", 1);
    private final Map<String, Vehicle> vehicles = new LinkedHashMap<>();

    public CustomerAccount(String name, String phone) {
        this.name = name;
        this.phone = phone;
    }

    @Override
    public String registerVehicle(Vehicle vehicle) {
        String vehicleId = vehicleIds.next();
        vehicles.put(vehicleId, vehicle);
        log.debug("Vehicle {} registered for {} as {}", vehicle.licensePlate(), name, vehicleId);
        return vehicleId;
    }

    /** Removes every registration of a vehicle with the same plate. */
    @Override
    public void removeVehicle(Vehicle vehicle) {
        vehicles.values().removeIf(v -> v.licensePlate().equals(vehicle.licensePlate()));
    }

    @Override
    public Optional<Vehicle> getVehicleById(String vehicleId) {
        return Optional.ofNullable(vehicles.get(vehicleId));
    }

    public Collection<Vehicle> getVehicles() {
        return Collections.unmodifiableCollection(vehicles.values());
    }
}
