package com.example.parking.service.exception;

import com.example.parking.model.SpotType;
import com.example.parking.model.VehicleType;
import lombok.Getter;

@Getter
public class IncompatibleSpotException extends ParkingException {

    private final VehicleType vehicleType;

    public IncompatibleSpotException(VehicleType vehicleType, SpotType spotType) {
        super(ParkingErrorCode.INCOMPATIBLE_CLASS,
                "Vehicle type " + vehicleType + " is not compatible with spot type " + spotType);
        this.vehicleType = vehicleType;
    }

    /** No spot of the lot, free or occupied, admits the vehicle type. */
    public IncompatibleSpotException(VehicleType vehicleType) {
        super(ParkingErrorCode.INCOMPATIBLE_CLASS,
                "No spot in this lot accepts vehicle type " + vehicleType);
        this.vehicleType = vehicleType;
    }
}
