package com.example.parking.controllers;

import com.example.parking.service.exception.ParkingException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class ParkingExceptionHandler {

    @ExceptionHandler(ParkingException.class)
    public ResponseEntity<Map<String, Object>> handleParking(ParkingException ex) {
        log.warn("Parking request failed: {} {}", ex.getCode(), ex.getMessage());

        HttpStatus status = switch (ex.getCode()) {
            case INVALID_TICKET -> HttpStatus.NOT_FOUND;
            case NO_AVAILABLE_SPOT, ALREADY_OCCUPIED, INCOMPATIBLE_CLASS -> HttpStatus.CONFLICT;
        };

        return ResponseEntity.status(status).body(Map.of(
                "timestamp", Instant.now().toString(),
                "code", ex.getCode().name(),
                "message", ex.getMessage()
        ));
    }
}
