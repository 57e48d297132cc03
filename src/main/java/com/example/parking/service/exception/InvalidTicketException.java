package com.example.parking.service.exception;

import lombok.Getter;

@Getter
public class InvalidTicketException extends ParkingException {

    private final String ticketId;

    public InvalidTicketException(String ticketId, String reason) {
        super(ParkingErrorCode.INVALID_TICKET, "Invalid ticket ID " + ticketId + ": " + reason);
        this.ticketId = ticketId;
    }
}
