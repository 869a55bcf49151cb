package com.carrental.rental.service;

import com.carrental.rental.access.AccessPolicy;
import com.carrental.rental.access.Actor;
import com.carrental.rental.constants.ValidationMessages;
import com.carrental.rental.dto.AvailabilityEntry;
import com.carrental.rental.dto.ConflictReport;
import com.carrental.rental.dto.VehicleEntry;
import com.carrental.rental.dto.VehicleFilterCriteria;
import com.carrental.rental.enums.BookingStatus;
import com.carrental.rental.enums.RentalAction;
import com.carrental.rental.exception.InvalidRangeException;
import com.carrental.rental.mapper.VehicleMapper;
import com.carrental.rental.model.Booking;
import com.carrental.rental.model.MaintenanceWindow;
import com.carrental.rental.model.Vehicle;
import com.carrental.rental.repository.BookingRepository;
import com.carrental.rental.repository.VehicleRepository;
import com.carrental.rental.util.DateRange;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Answers whether a vehicle is free for a date range. Only approved bookings and
 * maintenance windows block; pending and rejected bookings never do.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AvailabilityService {

    private final FleetService fleetService;
    private final MaintenanceService maintenanceService;
    private final BookingRepository bookingRepository;
    private final VehicleRepository vehicleRepository;
    private final AvailabilityCacheService cacheService;

    // ========== Conflict Detection ==========

    /**
     * Approved bookings and maintenance windows on the vehicle that overlap {@code range}.
     * Used both for the informational check at booking creation and for the authoritative
     * check at approval.
     *
     * @param excludeBookingId booking to leave out of the report, usually the one being approved
     */
    public ConflictReport findConflicts(Long vehicleId, DateRange range, Long excludeBookingId) {
        List<Booking> approved = range.isUnbounded()
                ? bookingRepository.findOverlappingFrom(vehicleId, BookingStatus.APPROVED, range.start())
                : bookingRepository.findOverlapping(vehicleId, BookingStatus.APPROVED, range.start(), range.end());

        List<Long> bookingIds = approved.stream()
                .filter(booking -> !Objects.equals(booking.getId(), excludeBookingId))
                .filter(booking -> booking.range().overlaps(range))
                .map(Booking::getId)
                .toList();

        List<Long> maintenanceIds = maintenanceService.windowsOverlapping(vehicleId, range).stream()
                .map(MaintenanceWindow::getId)
                .toList();

        ConflictReport report = new ConflictReport(bookingIds, maintenanceIds);
        if (!report.isEmpty()) {
            log.debug("Conflicts for vehicle {} in {}: bookings={}, maintenance={}",
                    vehicleId, range, bookingIds, maintenanceIds);
        }
        return report;
    }

    public boolean isAvailable(Long vehicleId, DateRange range) {
        return findConflicts(vehicleId, range, null).isEmpty();
    }

    // ========== Queries ==========

    /**
     * Single-vehicle check. A vehicle counts as available only when it is on the market,
     * its rental-day bounds accept the duration and nothing blocks the range.
     */
    @Transactional(readOnly = true)
    public AvailabilityEntry checkVehicle(Actor actor, Long vehicleId, DateRange range) {
        AccessPolicy.require(actor, RentalAction.SEARCH_AVAILABILITY);

        Vehicle vehicle = fleetService.findVehicleOrThrow(vehicleId);
        ConflictReport report = findConflicts(vehicleId, range, null);
        boolean available = Boolean.TRUE.equals(vehicle.getAvailableNow())
                && vehicle.acceptsDuration(range.durationDays())
                && report.isEmpty();

        return AvailabilityEntry.builder()
                .vehicleId(vehicleId)
                .startDate(range.start())
                .endDate(range.end())
                .available(available)
                .conflictingBookingIds(report.bookingIds())
                .conflictingMaintenanceIds(report.maintenanceIds())
                .build();
    }

    @Transactional(readOnly = true)
    public List<VehicleEntry> search(Actor actor, DateRange range, VehicleFilterCriteria criteria) {
        AccessPolicy.require(actor, RentalAction.SEARCH_AVAILABILITY);
        return search(range, criteria != null ? criteria : VehicleFilterCriteria.none());
    }

    /**
     * Vehicles free for the whole of {@code range}, ordered by id. The returned list is
     * immutable and can be iterated any number of times.
     */
    @Transactional(readOnly = true)
    public List<VehicleEntry> search(DateRange range, VehicleFilterCriteria criteria) {
        if (range.isUnbounded()) {
            throw new InvalidRangeException(ValidationMessages.END_DATE_REQUIRED);
        }
        OptionalLong generation = cacheService.currentGeneration();

        if (generation.isPresent()) {
            Optional<List<Long>> cached = cacheService.getSearchResult(generation.getAsLong(), range, criteria);
            if (cached.isPresent()) {
                return loadVehicles(cached.get());
            }
        }

        List<Vehicle> available = new ArrayList<>();
        for (Vehicle candidate : fleetService.candidatesFor(range, criteria)) {
            if (isAvailable(candidate.getId(), range)) {
                available.add(candidate);
            }
        }

        if (generation.isPresent()) {
            cacheService.putSearchResult(generation.getAsLong(), range, criteria,
                    available.stream().map(Vehicle::getId).toList());
        }

        log.debug("Availability search {}: {} vehicle(s)", range, available.size());
        return List.copyOf(VehicleMapper.toEntryList(available));
    }

    private List<VehicleEntry> loadVehicles(List<Long> vehicleIds) {
        List<Vehicle> vehicles = new ArrayList<>(vehicleRepository.findAllById(vehicleIds));
        vehicles.sort(Comparator.comparing(Vehicle::getId));
        return List.copyOf(VehicleMapper.toEntryList(vehicles));
    }
}
