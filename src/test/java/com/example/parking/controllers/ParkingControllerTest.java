package com.example.parking.controllers;

import com.example.parking.model.DisplayBoard;
import com.example.parking.model.ParkingCharge;
import com.example.parking.model.ParkingTicket;
import com.example.parking.model.Vehicle;
import com.example.parking.model.VehicleType;
import com.example.parking.service.ParkingService;
import com.example.parking.service.exception.IncompatibleSpotException;
import com.example.parking.service.exception.InvalidTicketException;
import com.example.parking.service.exception.NoAvailableSpotException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ParkingController.class)
class ParkingControllerTest {

    private static final Vehicle CAR = new Vehicle(VehicleType.COMPACT, "Toyota", "ABC123");

    @Autowired
    private MockMvc mvc;

    @MockBean
    private ParkingService parking;

    @Test
    void shouldReturnTicketForParkedVehicle() throws Exception {
        when(parking.parkVehicle(CAR)).thenReturn(
                ParkingTicket.issue("TKT_0", CAR, "spot_1_0", Instant.parse("2024-05-01T08:00:00Z")));

        mvc.perform(post("/parking/vehicles")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"type":"COMPACT","model":"Toyota","licensePlate":"ABC123"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.ticketId").value("TKT_0"))
                .andExpect(jsonPath("$.spotId").value("spot_1_0"))
                .andExpect(jsonPath("$.paymentStatus").value("PENDING"));
    }

    @Test
    void shouldRejectRequestWithoutPlate() throws Exception {
        mvc.perform(post("/parking/vehicles")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"LIGHT\",\"model\":\"Suzuki\"}"))
                .andExpect(status().isBadRequest());

        verify(parking, never()).parkVehicle(any());
    }

    @Test
    void fullLotMapsToConflict() throws Exception {
        when(parking.parkVehicle(any())).thenThrow(new NoAvailableSpotException(VehicleType.HEAVY));

        mvc.perform(post("/parking/vehicles")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"HEAVY\",\"model\":\"Mac\",\"licensePlate\":\"XYZ789\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("NO_AVAILABLE_SPOT"));
    }

    @Test
    void incompatibleVehicleMapsToConflict() throws Exception {
        when(parking.parkVehicle(any())).thenThrow(new IncompatibleSpotException(VehicleType.LIGHT));

        mvc.perform(post("/parking/vehicles")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"LIGHT\",\"model\":\"Suzuki\",\"licensePlate\":\"DEF456\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("INCOMPATIBLE_CLASS"));
    }

    @Test
    void shouldReturnChargeOnRelease() throws Exception {
        when(parking.unparkVehicle("TKT_0")).thenReturn(ParkingCharge.of(20.0));

        mvc.perform(post("/parking/tickets/TKT_0/release"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(20.0))
                .andExpect(jsonPath("$.chargeback").value(0.0));
    }

    @Test
    void unknownTicketReleaseMapsToNotFound() throws Exception {
        when(parking.unparkVehicle("nonexistent")).thenThrow(new InvalidTicketException("nonexistent", "not found"));

        mvc.perform(post("/parking/tickets/nonexistent/release"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("INVALID_TICKET"));
    }

    @Test
    void unknownTicketLookupIsNotFound() throws Exception {
        when(parking.findTicket("TKT_9")).thenReturn(Optional.empty());

        mvc.perform(get("/parking/tickets/TKT_9"))
                .andExpect(status().isNotFound());
    }

    @Test
    void shouldExposeBoard() throws Exception {
        when(parking.displayInfo()).thenReturn(new DisplayBoard("1234", 5, 55, 52, 3));

        mvc.perform(get("/parking/board"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.floors").value(5))
                .andExpect(jsonPath("$.freeSpots").value(52))
                .andExpect(jsonPath("$.parkedVehicles").value(3));
    }
}
