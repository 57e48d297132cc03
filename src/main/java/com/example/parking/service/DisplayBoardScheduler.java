package com.example.parking.service;

import com.example.parking.model.DisplayBoard;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class DisplayBoardScheduler {

    private final ParkingService parking;

    @Scheduled(cron = "${parking.board.refresh-cron}")
    public void refreshBoard() {
        DisplayBoard board = parking.displayInfo();
        log.info("Lot {}: {} floors, {} spots, {} free, {} vehicles parked",
                board.lotUid(), board.floors(), board.totalSpots(), board.freeSpots(), board.parkedVehicles());
    }
}
