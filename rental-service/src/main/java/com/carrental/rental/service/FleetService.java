package com.carrental.rental.service;

import com.carrental.rental.access.AccessPolicy;
import com.carrental.rental.access.Actor;
import com.carrental.rental.dto.PageResponse;
import com.carrental.rental.dto.VehicleEntry;
import com.carrental.rental.dto.VehicleFilterCriteria;
import com.carrental.rental.enums.RentalAction;
import com.carrental.rental.exception.ResourceNotFoundException;
import com.carrental.rental.exception.VehicleInUseException;
import com.carrental.rental.mapper.VehicleMapper;
import com.carrental.rental.model.Vehicle;
import com.carrental.rental.repository.BookingRepository;
import com.carrental.rental.repository.MaintenanceWindowRepository;
import com.carrental.rental.repository.VehicleRepository;
import com.carrental.rental.repository.VehicleSpecification;
import com.carrental.rental.util.DateRange;
import com.carrental.rental.validator.VehicleValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class FleetService {

    public static final Sort DEFAULT_LISTING_ORDER = Sort.by(Sort.Order.desc("year"),
            Sort.Order.asc("make"), Sort.Order.asc("model"));

    private final VehicleRepository vehicleRepository;
    private final BookingRepository bookingRepository;
    private final MaintenanceWindowRepository maintenanceRepository;
    private final AvailabilityCacheService cacheService;

    // ========== CRUD Operations ==========

    @Transactional
    public VehicleEntry createVehicle(Actor actor, VehicleEntry request) {
        AccessPolicy.require(actor, RentalAction.MANAGE_FLEET);
        VehicleValidator.validateNewVehicle(request);

        Vehicle vehicle = VehicleMapper.toEntity(request);
        VehicleValidator.validateVehicle(vehicle);

        Vehicle saved = vehicleRepository.save(vehicle);
        cacheService.invalidate();

        log.info("Created vehicle: id={}, label={}, rate={}", saved.getId(), saved.label(), saved.getDailyRate());
        return VehicleMapper.toEntry(saved);
    }

    @Transactional
    public VehicleEntry updateVehicle(Actor actor, Long vehicleId, VehicleEntry changes) {
        AccessPolicy.require(actor, RentalAction.MANAGE_FLEET);
        VehicleValidator.validateVehicleId(vehicleId);

        Vehicle vehicle = findVehicleOrThrow(vehicleId);
        VehicleMapper.updateEntity(vehicle, changes);
        VehicleValidator.validateVehicle(vehicle);

        Vehicle saved = vehicleRepository.save(vehicle);
        cacheService.invalidate();

        log.info("Updated vehicle: id={}", vehicleId);
        return VehicleMapper.toEntry(saved);
    }

    /**
     * Administrative off-market override. Independent of bookings and maintenance.
     */
    @Transactional
    public VehicleEntry setAvailability(Actor actor, Long vehicleId, boolean available) {
        AccessPolicy.require(actor, RentalAction.MANAGE_FLEET);

        Vehicle vehicle = findVehicleOrThrow(vehicleId);
        vehicle.setAvailableNow(available);
        Vehicle saved = vehicleRepository.save(vehicle);
        cacheService.invalidate();

        log.info("Vehicle availability set: id={}, availableNow={}", vehicleId, available);
        return VehicleMapper.toEntry(saved);
    }

    @Transactional
    public void deleteVehicle(Actor actor, Long vehicleId) {
        AccessPolicy.require(actor, RentalAction.MANAGE_FLEET);

        Vehicle vehicle = findVehicleOrThrow(vehicleId);
        if (bookingRepository.existsByVehicle_Id(vehicleId) || maintenanceRepository.existsByVehicle_Id(vehicleId)) {
            log.warn("Refusing to delete referenced vehicle: id={}", vehicleId);
            throw new VehicleInUseException(vehicleId);
        }

        vehicleRepository.delete(vehicle);
        cacheService.invalidate();

        log.info("Deleted vehicle: id={}", vehicleId);
    }

    // ========== Query Operations ==========

    @Transactional(readOnly = true)
    public VehicleEntry getVehicle(Actor actor, Long vehicleId) {
        AccessPolicy.require(actor, RentalAction.VIEW_FLEET);
        return VehicleMapper.toEntry(findVehicleOrThrow(vehicleId));
    }

    @Transactional(readOnly = true)
    public PageResponse<VehicleEntry> listVehicles(Actor actor, VehicleFilterCriteria criteria, Pageable pageable) {
        AccessPolicy.require(actor, RentalAction.VIEW_FLEET);

        Page<Vehicle> page = vehicleRepository.findAll(VehicleSpecification.withCriteria(criteria), pageable);
        return PageResponse.of(page.map(VehicleMapper::toEntry));
    }

    /**
     * On-market vehicles whose rental-day bounds accept the range's duration, ordered by id.
     * Bookings and maintenance are not consulted here.
     */
    @Transactional(readOnly = true)
    public List<Vehicle> candidatesFor(DateRange range, VehicleFilterCriteria criteria) {
        int days = range.durationDays();
        List<Vehicle> candidates = vehicleRepository.findAll(
                VehicleSpecification.candidatesFor(days, criteria), Sort.by(Sort.Direction.ASC, "id"));
        log.debug("Candidates for {} ({} days): {}", range, days, candidates.size());
        return candidates;
    }

    public Vehicle findVehicleOrThrow(Long vehicleId) {
        VehicleValidator.validateVehicleId(vehicleId);
        return vehicleRepository.findById(vehicleId)
                .orElseThrow(() -> ResourceNotFoundException.vehicle(vehicleId));
    }

    /**
     * Loads the vehicle under a row lock. Must run inside a transaction.
     */
    public Vehicle lockVehicle(Long vehicleId) {
        VehicleValidator.validateVehicleId(vehicleId);
        return vehicleRepository.findByIdForUpdate(vehicleId)
                .orElseThrow(() -> ResourceNotFoundException.vehicle(vehicleId));
    }
}
