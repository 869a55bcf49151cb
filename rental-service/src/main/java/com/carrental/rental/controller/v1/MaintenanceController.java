package com.carrental.rental.controller.v1;

import com.carrental.rental.constants.RentalConstants;
import com.carrental.rental.dto.MaintenanceCloseRequest;
import com.carrental.rental.dto.MaintenanceEntry;
import com.carrental.rental.dto.MaintenanceOpenRequest;
import com.carrental.rental.service.MaintenanceService;
import com.carrental.rental.service.UserService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/v1/maintenance")
public class MaintenanceController {

    private final MaintenanceService maintenanceService;
    private final UserService userService;

    @PostMapping
    public ResponseEntity<MaintenanceEntry> open(
            @RequestHeader(RentalConstants.USER_ID_HEADER) Long userId,
            @Valid @RequestBody MaintenanceOpenRequest request) {
        log.info("POST /v1/maintenance: vehicleId={}, type={}, start={}",
                request.getVehicleId(), request.getType(), request.getStartDate());

        MaintenanceEntry opened = maintenanceService.openWindow(userService.resolveActor(userId), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(opened);
    }

    @PostMapping("/{windowId}/close")
    public ResponseEntity<MaintenanceEntry> close(
            @RequestHeader(RentalConstants.USER_ID_HEADER) Long userId,
            @PathVariable Long windowId,
            @RequestBody(required = false) MaintenanceCloseRequest request) {
        log.info("POST /v1/maintenance/{}/close: end={}", windowId, request != null ? request.getEndDate() : null);

        return ResponseEntity.ok(maintenanceService.closeWindow(userService.resolveActor(userId), windowId, request));
    }

    @GetMapping("/{windowId}")
    public ResponseEntity<MaintenanceEntry> getById(
            @RequestHeader(RentalConstants.USER_ID_HEADER) Long userId,
            @PathVariable Long windowId) {
        log.debug("GET /v1/maintenance/{}", windowId);
        return ResponseEntity.ok(maintenanceService.getWindow(userService.resolveActor(userId), windowId));
    }

    @GetMapping("/vehicles/{vehicleId}/active")
    public ResponseEntity<List<MaintenanceEntry>> activeForVehicle(
            @RequestHeader(RentalConstants.USER_ID_HEADER) Long userId,
            @PathVariable Long vehicleId) {
        log.debug("GET /v1/maintenance/vehicles/{}/active", vehicleId);
        return ResponseEntity.ok(maintenanceService.activeForVehicle(userService.resolveActor(userId), vehicleId));
    }

    @GetMapping
    public ResponseEntity<List<MaintenanceEntry>> list(
            @RequestHeader(RentalConstants.USER_ID_HEADER) Long userId,
            @RequestParam(required = false) Boolean activeOnly,
            @RequestParam(required = false) Long vehicleId,
            @RequestParam(defaultValue = "start_desc") String sort) {
        log.debug("GET /v1/maintenance: activeOnly={}, vehicleId={}, sort={}", activeOnly, vehicleId, sort);
        return ResponseEntity.ok(maintenanceService.listWindows(
                userService.resolveActor(userId), activeOnly, vehicleId, sort));
    }
}
