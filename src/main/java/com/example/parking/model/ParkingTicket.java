package com.example.parking.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class ParkingTicket {

    private String ticketId;

    private Vehicle vehicle;

    /** id of the occupied spot, unique within the lot */
    private String spotId;

    private Instant entryTime;

    /** null while the vehicle is still parked */
    private Instant exitTime;

    @Builder.Default
    private PaymentStatus paymentStatus = PaymentStatus.PENDING;

    public static ParkingTicket issue(String ticketId, Vehicle vehicle, String spotId, Instant entryTime) {
        return ParkingTicket.builder()
                .ticketId(ticketId)
                .vehicle(vehicle)
                .spotId(spotId)
                .entryTime(entryTime)
                .build();
    }

    public boolean isCompleted() {
        return exitTime != null;
    }

    public ParkingTicket copy() {
        return toBuilder().build();
    }
}
