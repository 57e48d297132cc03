package com.example.parking.service;

import com.example.parking.model.ParkingFloor;
import com.example.parking.model.ParkingTicket;
import com.example.parking.model.SpotType;
import com.example.parking.model.Vehicle;
import com.example.parking.model.VehicleType;
import com.example.parking.service.exception.ParkingException;
import com.example.parking.service.impl.CustomerAccount;
import com.example.parking.service.impl.ParkingLot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Walk-through of a typical day: extra large spots on the ground floor, one customer
 * parking a car, a truck and a bike, then the bike leaving.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "parking.demo.enabled", havingValue = "true")
public class ParkingDemoRunner implements CommandLineRunner {

    private static final int GROUND_FLOOR = 1;
    private static final int TRUCK_SPOTS = 5;

    private final ParkingLot lot;
    private final DisplayBoardScheduler boardScheduler;

    @Override
    public void run(String... args) {
        log.info("Parking lot demo for '{}' at {}", lot.getName(), lot.getAddress());

        Optional<ParkingFloor> groundFloor = lot.getFloorById(GROUND_FLOOR);
        groundFloor.ifPresentOrElse(
                floor -> {
                    for (int i = 0; i < TRUCK_SPOTS; i++) {
                        floor.addSpot(SpotType.LARGE);
                    }
                },
                () -> log.warn("Floor {} is not configured, trucks will not fit", GROUND_FLOOR));
        boardScheduler.refreshBoard();

        CustomerAccount customer = new CustomerAccount("Larry", "123");
        List<Vehicle> vehicles = List.of(
                new Vehicle(VehicleType.COMPACT, "Toyota", "ABC123"),
                new Vehicle(VehicleType.HEAVY, "Mac", "XYZ789"),
                new Vehicle(VehicleType.LIGHT, "Suzuki", "DEF456"));
        vehicles.forEach(customer::registerVehicle);

        String lastTicketId = null;
        for (Vehicle vehicle : vehicles) {
            try {
                ParkingTicket ticket = lot.parkVehicle(vehicle);
                lastTicketId = ticket.getTicketId();
            } catch (ParkingException e) {
                log.error("Could not park {}: {}", vehicle.licensePlate(), e.getMessage());
            }
        }
        boardScheduler.refreshBoard();

        if (lastTicketId == null) {
            return;
        }
        try {
            var charge = lot.unparkVehicle(lastTicketId);
            log.info("Grand total: {}, chargeback: {}", charge.total(), charge.chargeback());
        } catch (ParkingException e) {
            log.error("Could not unpark ticket {}: {}", lastTicketId, e.getMessage());
        }
        boardScheduler.refreshBoard();
    }
}
