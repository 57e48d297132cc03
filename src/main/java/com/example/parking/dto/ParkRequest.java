package com.example.parking.dto;

import com.example.parking.model.Vehicle;
import com.example.parking.model.VehicleType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ParkRequest {

    private VehicleType type;

    private String model;

    private String licensePlate;

    public boolean isComplete() {
        return type != null && licensePlate != null && !licensePlate.isBlank();
    }

    public Vehicle toVehicle() {
        return new Vehicle(type, model, licensePlate);
    }
}
