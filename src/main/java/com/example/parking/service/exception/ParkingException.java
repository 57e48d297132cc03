package com.example.parking.service.exception;

import lombok.Getter;

/**
 * Base class of every allocation or release failure. Callers switch on {@link #getCode()}
 * when they need the kind without catching each subclass.
 */
@Getter
public abstract class ParkingException extends RuntimeException {

    private final ParkingErrorCode code;

    protected ParkingException(ParkingErrorCode code, String message) {
        super(message);
        this.code = code;
    }
}
