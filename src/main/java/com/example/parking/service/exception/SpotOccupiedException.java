package com.example.parking.service.exception;

import lombok.Getter;

@Getter
public class SpotOccupiedException extends ParkingException {

    private final String spotId;

    public SpotOccupiedException(String spotId) {
        super(ParkingErrorCode.ALREADY_OCCUPIED, "Spot " + spotId + " is already occupied");
        this.spotId = spotId;
    }
}
