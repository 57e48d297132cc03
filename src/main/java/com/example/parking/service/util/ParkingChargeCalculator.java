package com.example.parking.service.util;

import com.example.parking.model.ParkingCharge;

import java.time.Duration;
import java.time.Instant;

public final class ParkingChargeCalculator {

    public static final double DEFAULT_RATE_PER_HOUR = 10.0;

    private ParkingChargeCalculator() {
    }

    /**
     * Bills whole hours only: 59 minutes cost nothing, 119 minutes cost one hour.
     * An exit before the entry (clock adjustment) bills zero.
     */
    public static double amount(Instant entry, Instant exit, double ratePerHour) {
        long hours = Math.max(0, Duration.between(entry, exit).toHours());
        return hours * ratePerHour;
    }

    public static ParkingCharge calculate(Instant entry, Instant exit, double ratePerHour) {
        return ParkingCharge.of(amount(entry, exit, ratePerHour));
    }
}
