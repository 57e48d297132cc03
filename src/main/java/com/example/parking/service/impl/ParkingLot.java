package com.example.parking.service.impl;

import com.example.parking.model.DisplayBoard;
import com.example.parking.model.ParkingCharge;
import com.example.parking.model.ParkingFloor;
import com.example.parking.model.ParkingTicket;
import com.example.parking.model.PaymentStatus;
import com.example.parking.model.Vehicle;
import com.example.parking.service.ParkingService;
import com.example.parking.service.exception.IncompatibleSpotException;
import com.example.parking.service.exception.InvalidTicketException;
import com.example.parking.service.exception.NoAvailableSpotException;
import com.example.parking.service.util.IdSequence;
import com.example.parking.service.util.ParkingChargeCalculator;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Owns the floors and the ticket table of one lot.
 * <p>
 * Lock order: the floor-table lock is always taken before a floor's spot lock. The
 * ticket-table lock is never held together with either of them.
 * <p>
 * Allocation is optimistic: the scan and the occupy run in two separate critical
 * sections, and {@link ParkingFloor#occupySpot} re-checks the spot. A spot taken in
 * between surfaces as {@link com.example.parking.service.exception.SpotOccupiedException};
 * no retry happens here.
 */
@Slf4j
public class ParkingLot implements ParkingService {

    @Getter
    private final String name;

    @Getter
    private final String address;

    @Getter
    private final String uid;

    private final IdSequence ticketIds;
    private final Clock clock;
    private final double ratePerHour;

    private final Map<Integer, ParkingFloor> floors = new LinkedHashMap<>();
    private final ReentrantLock floorsLock = new ReentrantLock();

    // active and completed tickets share this table
    private final Map<String, ParkingTicket> tickets = new HashMap<>();
    private final ReentrantLock ticketsLock = new ReentrantLock();

    public ParkingLot(String name, String address, String uid) {
        this(name, address, uid, new IdSequence("TKT_"), Clock.systemUTC(),
                ParkingChargeCalculator.DEFAULT_RATE_PER_HOUR);
    }

    public ParkingLot(String name, String address, String uid,
                      IdSequence ticketIds, Clock clock, double ratePerHour) {
        this.name = name;
        this.address = address;
        this.uid = uid;
        this.ticketIds = ticketIds;
        this.clock = clock;
        this.ratePerHour = ratePerHour;
    }

    /** Inserts under the floor's id; an existing floor with the same id is replaced. */
    public void addFloor(ParkingFloor floor) {
        ParkingFloor replaced = withFloors(table -> table.put(floor.getId(), floor));
        if (replaced != null) {
            log.warn("Floor {} of lot {} replaced", floor.getId(), uid);
        }
    }

    /** Returns the live floor, so spots added to it become allocatable immediately. */
    public Optional<ParkingFloor> getFloorById(int floorId) {
        return withFloors(table -> Optional.ofNullable(table.get(floorId)));
    }

    @Override
    public ParkingTicket parkVehicle(Vehicle vehicle) {
        SpotCandidate candidate = withFloors(table -> {
            boolean anySpot = false;
            boolean anyCompatible = false;
            for (ParkingFloor floor : table.values()) {
                Optional<String> spotId = floor.findAvailableSpot(vehicle.type());
                if (spotId.isPresent()) {
                    return new SpotCandidate(floor.getId(), spotId.get());
                }
                anySpot = anySpot || floor.getSpotCount() > 0;
                anyCompatible = anyCompatible || floor.hasCompatibleSpot(vehicle.type());
            }
            if (anySpot && !anyCompatible) {
                log.warn("No spot in lot {} accepts {} {}", uid, vehicle.type(), vehicle.licensePlate());
                throw new IncompatibleSpotException(vehicle.type());
            }
            log.warn("No available spots in lot {} for {} {}", uid, vehicle.type(), vehicle.licensePlate());
            throw new NoAvailableSpotException(vehicle.type());
        });

        log.debug("Spot {} on floor {} selected for {}", candidate.spotId(), candidate.floorId(), vehicle.licensePlate());

        withFloors(table -> {
            ParkingFloor floor = table.get(candidate.floorId());
            if (floor == null) {
                throw new NoAvailableSpotException(vehicle.type());
            }
            floor.occupySpot(candidate.spotId(), vehicle);
            return floor;
        });

        ParkingTicket ticket = ParkingTicket.issue(ticketIds.next(), vehicle, candidate.spotId(), clock.instant());
        withTickets(table -> table.put(ticket.getTicketId(), ticket));

        log.info("Vehicle {} parked at spot {} on floor {}. Ticket ID: {}",
                vehicle.licensePlate(), candidate.spotId(), candidate.floorId(), ticket.getTicketId());
        return ticket.copy();
    }

    @Override
    public ParkingCharge unparkVehicle(String ticketId) {
        ParkingTicket ticket = withTickets(table -> {
            ParkingTicket found = table.get(ticketId);
            if (found == null) {
                throw new InvalidTicketException(ticketId, "not found");
            }
            if (found.isCompleted()) {
                throw new InvalidTicketException(ticketId, "already released");
            }
            return table.remove(ticketId);
        });

        boolean vacated = withFloors(table -> table.values().stream()
                .anyMatch(floor -> floor.vacateSpot(ticket.getSpotId())));
        if (!vacated) {
            log.warn("Spot {} of ticket {} not found on any floor of lot {}", ticket.getSpotId(), ticketId, uid);
        }

        Instant exitTime = clock.instant();
        ParkingCharge charge = ParkingChargeCalculator.calculate(ticket.getEntryTime(), exitTime, ratePerHour);

        ticket.setExitTime(exitTime);
        ticket.setPaymentStatus(PaymentStatus.SUCCEEDED);
        withTickets(table -> table.put(ticketId, ticket));

        log.info("Vehicle {} unparked. Ticket ID: {}, total charge: {}",
                ticket.getVehicle().licensePlate(), ticketId, String.format("%.2f", charge.total()));
        return charge;
    }

    @Override
    public Optional<ParkingTicket> findTicket(String ticketId) {
        return withTickets(table -> Optional.ofNullable(table.get(ticketId)).map(ParkingTicket::copy));
    }

    @Override
    public DisplayBoard displayInfo() {
        return withFloors(table -> {
            int totalSpots = 0;
            int freeSpots = 0;
            int parked = 0;
            for (ParkingFloor floor : table.values()) {
                totalSpots += floor.getSpotCount();
                freeSpots += floor.getFreeSpotCount();
                parked += floor.getOccupiedSpotCount();
            }
            return new DisplayBoard(uid, table.size(), totalSpots, freeSpots, parked);
        });
    }

    private <T> T withFloors(Function<Map<Integer, ParkingFloor>, T> action) {
        floorsLock.lock();
        try {
            return action.apply(floors);
        } finally {
            floorsLock.unlock();
        }
    }

    private <T> T withTickets(Function<Map<String, ParkingTicket>, T> action) {
        ticketsLock.lock();
        try {
            return action.apply(tickets);
        } finally {
            ticketsLock.unlock();
        }
    }

    private record SpotCandidate(int floorId, String spotId) {}
}
