package com.carrental.rental.controller.v1;

import com.carrental.rental.access.Actor;
import com.carrental.rental.constants.RentalConstants;
import com.carrental.rental.dto.PageResponse;
import com.carrental.rental.dto.VehicleEntry;
import com.carrental.rental.dto.VehicleFilterCriteria;
import com.carrental.rental.service.FleetService;
import com.carrental.rental.service.UserService;
import com.carrental.rental.util.PaginationUtils;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Set;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/v1/vehicles")
public class VehicleController {

    private static final Set<String> ALLOWED_SORT_FIELDS = Set.of(
            "id", "make", "model", "year", "dailyRate", "mileage");

    private final FleetService fleetService;
    private final UserService userService;

    @PostMapping
    public ResponseEntity<VehicleEntry> create(
            @RequestHeader(RentalConstants.USER_ID_HEADER) Long userId,
            @Valid @RequestBody VehicleEntry entry) {
        log.info("POST /v1/vehicles: make={}, model={}, year={}", entry.getMake(), entry.getModel(), entry.getYear());

        Actor actor = userService.resolveActor(userId);
        VehicleEntry created = fleetService.createVehicle(actor, entry);

        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping
    public ResponseEntity<PageResponse<VehicleEntry>> list(
            @RequestHeader(RentalConstants.USER_ID_HEADER) Long userId,
            @RequestParam(required = false) String make,
            @RequestParam(required = false) String model,
            @RequestParam(required = false) Integer yearMin,
            @RequestParam(required = false) Integer yearMax,
            @RequestParam(required = false) Boolean available,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "" + RentalConstants.DEFAULT_PAGE_SIZE) int size,
            @RequestParam(required = false) String sortBy,
            @RequestParam(defaultValue = "asc") String sortDirection) {

        log.debug("GET /v1/vehicles: make={}, model={}, years={}..{}, available={}",
                make, model, yearMin, yearMax, available);

        Actor actor = userService.resolveActor(userId);
        VehicleFilterCriteria criteria = VehicleFilterCriteria.builder()
                .make(make)
                .model(model)
                .yearMin(yearMin)
                .yearMax(yearMax)
                .available(available)
                .build();

        Pageable pageable = PaginationUtils.pageable(page, size, resolveSort(sortBy, sortDirection));
        return ResponseEntity.ok(fleetService.listVehicles(actor, criteria, pageable));
    }

    @GetMapping("/{vehicleId}")
    public ResponseEntity<VehicleEntry> getById(
            @RequestHeader(RentalConstants.USER_ID_HEADER) Long userId,
            @PathVariable Long vehicleId) {
        log.debug("GET /v1/vehicles/{}", vehicleId);
        return ResponseEntity.ok(fleetService.getVehicle(userService.resolveActor(userId), vehicleId));
    }

    @PutMapping("/{vehicleId}")
    public ResponseEntity<VehicleEntry> update(
            @RequestHeader(RentalConstants.USER_ID_HEADER) Long userId,
            @PathVariable Long vehicleId,
            @RequestBody VehicleEntry changes) {
        log.info("PUT /v1/vehicles/{}", vehicleId);

        Actor actor = userService.resolveActor(userId);
        return ResponseEntity.ok(fleetService.updateVehicle(actor, vehicleId, changes));
    }

    @PutMapping("/{vehicleId}/availability")
    public ResponseEntity<VehicleEntry> setAvailability(
            @RequestHeader(RentalConstants.USER_ID_HEADER) Long userId,
            @PathVariable Long vehicleId,
            @RequestParam boolean available) {
        log.info("PUT /v1/vehicles/{}/availability: available={}", vehicleId, available);

        Actor actor = userService.resolveActor(userId);
        return ResponseEntity.ok(fleetService.setAvailability(actor, vehicleId, available));
    }

    @DeleteMapping("/{vehicleId}")
    public ResponseEntity<Void> delete(
            @RequestHeader(RentalConstants.USER_ID_HEADER) Long userId,
            @PathVariable Long vehicleId) {
        log.info("DELETE /v1/vehicles/{}", vehicleId);

        fleetService.deleteVehicle(userService.resolveActor(userId), vehicleId);
        return ResponseEntity.noContent().build();
    }

    private Sort resolveSort(String sortBy, String sortDirection) {
        if (sortBy == null) {
            return FleetService.DEFAULT_LISTING_ORDER;
        }
        if (!ALLOWED_SORT_FIELDS.contains(sortBy)) {
            log.warn("Invalid sort field '{}', using default listing order", sortBy);
            return FleetService.DEFAULT_LISTING_ORDER;
        }
        Sort.Direction direction = "desc".equalsIgnoreCase(sortDirection)
                ? Sort.Direction.DESC
                : Sort.Direction.ASC;
        return Sort.by(direction, sortBy);
    }
}
