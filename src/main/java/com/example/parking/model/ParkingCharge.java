package com.example.parking.model;

public record ParkingCharge(double total, double chargeback) {

    public static ParkingCharge of(double total) {
        return new ParkingCharge(total, 0.0);
    }
}
