package com.carrental.rental.service;

import com.carrental.rental.access.AccessPolicy;
import com.carrental.rental.access.Actor;
import com.carrental.rental.dto.MaintenanceCloseRequest;
import com.carrental.rental.dto.MaintenanceEntry;
import com.carrental.rental.dto.MaintenanceOpenRequest;
import com.carrental.rental.enums.BookingStatus;
import com.carrental.rental.enums.RentalAction;
import com.carrental.rental.exception.InvalidStateException;
import com.carrental.rental.exception.ResourceNotFoundException;
import com.carrental.rental.mapper.MaintenanceMapper;
import com.carrental.rental.model.Booking;
import com.carrental.rental.model.MaintenanceWindow;
import com.carrental.rental.model.Vehicle;
import com.carrental.rental.repository.BookingRepository;
import com.carrental.rental.repository.MaintenanceSpecification;
import com.carrental.rental.repository.MaintenanceWindowRepository;
import com.carrental.rental.util.DateRange;
import com.carrental.rental.validator.MaintenanceValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class MaintenanceService {

    private final MaintenanceWindowRepository maintenanceRepository;
    private final BookingRepository bookingRepository;
    private final FleetService fleetService;
    private final PricingService pricingService;
    private final AvailabilityCacheService cacheService;

    // ========== Ledger Operations ==========

    /**
     * Opens a window on the vehicle. Approved bookings that fall inside it are kept and
     * reported back so an administrator can follow up.
     */
    @Transactional
    public MaintenanceEntry openWindow(Actor actor, MaintenanceOpenRequest request) {
        AccessPolicy.require(actor, RentalAction.MANAGE_MAINTENANCE);
        MaintenanceValidator.validateOpenRequest(request);

        Vehicle vehicle = fleetService.lockVehicle(request.getVehicleId());

        MaintenanceWindow window = MaintenanceWindow.builder()
                .vehicle(vehicle)
                .type(request.getType().trim())
                .cost(pricingService.scale(request.getCost() != null ? request.getCost() : BigDecimal.ZERO))
                .startDate(request.getStartDate())
                .notes(request.getNotes())
                .build();
        MaintenanceWindow saved = maintenanceRepository.save(window);

        List<Long> overlapping = approvedBookingsOverlapping(vehicle.getId(), saved.coverage());
        if (!overlapping.isEmpty()) {
            log.warn("Maintenance {} on vehicle {} overlaps approved bookings {}",
                    saved.getId(), vehicle.getId(), overlapping);
        }

        cacheService.invalidate();

        log.info("Opened maintenance: id={}, vehicleId={}, type={}, start={}",
                saved.getId(), vehicle.getId(), saved.getType(), saved.getStartDate());
        return MaintenanceMapper.toEntry(saved, overlapping);
    }

    /**
     * Closes an open window. The end date is inclusive and defaults to today.
     */
    @Transactional
    public MaintenanceEntry closeWindow(Actor actor, Long windowId, MaintenanceCloseRequest request) {
        AccessPolicy.require(actor, RentalAction.MANAGE_MAINTENANCE);

        MaintenanceWindow window = findWindowOrThrow(windowId);
        if (!window.isOpen()) {
            throw new InvalidStateException("Maintenance window " + windowId + " is already closed");
        }

        LocalDate endDate = request != null && request.getEndDate() != null ? request.getEndDate() : LocalDate.now();
        MaintenanceValidator.validateCloseDate(window.getStartDate(), endDate);

        window.setEndDate(endDate);
        if (request != null && request.getNotes() != null) {
            window.setNotes(request.getNotes());
        }
        MaintenanceWindow saved = maintenanceRepository.save(window);
        cacheService.invalidate();

        log.info("Closed maintenance: id={}, end={}", windowId, endDate);
        return MaintenanceMapper.toEntry(saved);
    }

    // ========== Query Operations ==========

    @Transactional(readOnly = true)
    public MaintenanceEntry getWindow(Actor actor, Long windowId) {
        AccessPolicy.require(actor, RentalAction.MANAGE_MAINTENANCE);
        return MaintenanceMapper.toEntry(findWindowOrThrow(windowId));
    }

    /**
     * @param activeOnly true for open windows, false for closed ones, null for all
     * @param sort       {@code start_asc} or {@code start_desc}
     */
    @Transactional(readOnly = true)
    public List<MaintenanceEntry> listWindows(Actor actor, Boolean activeOnly, Long vehicleId, String sort) {
        AccessPolicy.require(actor, RentalAction.MANAGE_MAINTENANCE);

        Sort.Direction direction = "start_asc".equalsIgnoreCase(sort) ? Sort.Direction.ASC : Sort.Direction.DESC;
        List<MaintenanceWindow> windows = maintenanceRepository.findAll(
                MaintenanceSpecification.withFilters(activeOnly, vehicleId),
                Sort.by(direction, "startDate").and(Sort.by(direction, "id")));
        return MaintenanceMapper.toEntryList(windows);
    }

    /**
     * Open windows on one vehicle, earliest first.
     */
    @Transactional(readOnly = true)
    public List<MaintenanceEntry> activeForVehicle(Actor actor, Long vehicleId) {
        AccessPolicy.require(actor, RentalAction.MANAGE_MAINTENANCE);
        fleetService.findVehicleOrThrow(vehicleId);
        return MaintenanceMapper.toEntryList(maintenanceRepository.findOpenByVehicleId(vehicleId));
    }

    /**
     * Windows on the vehicle whose inclusive coverage intersects {@code range}.
     */
    public List<MaintenanceWindow> windowsOverlapping(Long vehicleId, DateRange range) {
        List<MaintenanceWindow> candidates = range.isUnbounded()
                ? maintenanceRepository.findOverlappingFrom(vehicleId, range.start())
                : maintenanceRepository.findOverlapping(vehicleId, range.start(), range.end());
        return candidates.stream()
                .filter(window -> window.coverage().overlaps(range))
                .toList();
    }

    public MaintenanceWindow findWindowOrThrow(Long windowId) {
        return maintenanceRepository.findById(windowId)
                .orElseThrow(() -> ResourceNotFoundException.maintenance(windowId));
    }

    // ========== Private Helpers ==========

    private List<Long> approvedBookingsOverlapping(Long vehicleId, DateRange coverage) {
        List<Booking> approved = coverage.isUnbounded()
                ? bookingRepository.findOverlappingFrom(vehicleId, BookingStatus.APPROVED, coverage.start())
                : bookingRepository.findOverlapping(vehicleId, BookingStatus.APPROVED, coverage.start(), coverage.end());
        return approved.stream()
                .filter(booking -> booking.range().overlaps(coverage))
                .map(Booking::getId)
                .toList();
    }
}
