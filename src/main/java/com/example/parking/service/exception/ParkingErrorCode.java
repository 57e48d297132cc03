package com.example.parking.service.exception;

public enum ParkingErrorCode {
    NO_AVAILABLE_SPOT,
    ALREADY_OCCUPIED,
    INCOMPATIBLE_CLASS,
    INVALID_TICKET
}
