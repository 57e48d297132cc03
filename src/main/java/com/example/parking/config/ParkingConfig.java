package com.example.parking.config;

import com.example.parking.model.ParkingFloor;
import com.example.parking.service.impl.ParkingLot;
import com.example.parking.service.util.IdSequence;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;

import java.time.Clock;

@Slf4j
@Configuration
@Data
@PropertySource("classpath:application.properties")
public class ParkingConfig {

    @Value("${parking.lot.name}")
    String lotName;

    @Value("${parking.lot.address}")
    String lotAddress;

    @Value("${parking.lot.uid}")
    String lotUid;

    @Value("${parking.lot.floors:1}")
    int floors;

    @Value("${parking.floor.default-spots:10}")
    int defaultSpotsPerFloor;

    @Value("${parking.billing.rate-per-hour:10.0}")
    double ratePerHour;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ParkingLot parkingLot(Clock clock) {
        ParkingLot lot = new ParkingLot(lotName, lotAddress, lotUid, new IdSequence("TKT_"), clock, ratePerHour);
        for (int floorId = 1; floorId <= floors; floorId++) {
            lot.addFloor(new ParkingFloor(floorId, defaultSpotsPerFloor));
        }
        log.info("Parking lot '{}' ({}) ready with {} floors of {} spots, rate {}/h",
                lotName, lotUid, floors, defaultSpotsPerFloor, ratePerHour);
        return lot;
    }
}
