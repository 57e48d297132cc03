package com.example.parking.service.exception;

import com.example.parking.model.VehicleType;
import lombok.Getter;

@Getter
public class NoAvailableSpotException extends ParkingException {

    private final VehicleType vehicleType;

    public NoAvailableSpotException(VehicleType vehicleType) {
        super(ParkingErrorCode.NO_AVAILABLE_SPOT, "No available spots for " + vehicleType);
        this.vehicleType = vehicleType;
    }
}
