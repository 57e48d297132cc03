package com.example.parking.service;

import com.example.parking.model.DisplayBoard;
import com.example.parking.model.ParkingCharge;
import com.example.parking.model.ParkingTicket;
import com.example.parking.model.Vehicle;

import java.util.Optional;

public interface ParkingService {

    /** Allocates a spot and returns a copy of the freshly issued ticket. */
    ParkingTicket parkVehicle(Vehicle vehicle);

    /** Frees the ticket's spot and bills the stay. */
    ParkingCharge unparkVehicle(String ticketId);

    /** Active or completed ticket, as a copy */
    Optional<ParkingTicket> findTicket(String ticketId);

    DisplayBoard displayInfo();
}
