package com.example.parking.controllers;

import com.example.parking.dto.ParkRequest;
import com.example.parking.model.DisplayBoard;
import com.example.parking.model.ParkingCharge;
import com.example.parking.model.ParkingTicket;
import com.example.parking.service.ParkingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@Slf4j
@RestController
@RequestMapping("/parking")
@RequiredArgsConstructor
public class ParkingController {

    private final ParkingService parking;

    @PostMapping("/vehicles")
    public ResponseEntity<ParkingTicket> park(@RequestBody ParkRequest request) {
        if (!request.isComplete()) {
            log.warn("Rejected incomplete park request: {}", request);
            return ResponseEntity.badRequest().build();
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(parking.parkVehicle(request.toVehicle()));
    }

    @PostMapping("/tickets/{ticketId}/release")
    public ResponseEntity<ParkingCharge> release(@PathVariable String ticketId) {
        return ResponseEntity.ok(parking.unparkVehicle(ticketId));
    }

    /** Active and already released tickets alike. */
    @GetMapping("/tickets/{ticketId}")
    public ResponseEntity<ParkingTicket> getTicket(@PathVariable String ticketId) {
        return parking.findTicket(ticketId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/board")
    public DisplayBoard board() {
        return parking.displayInfo();
    }
}
