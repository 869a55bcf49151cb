package com.carrental.rental.controller.v1;

import com.carrental.rental.access.Actor;
import com.carrental.rental.constants.RentalConstants;
import com.carrental.rental.dto.AvailabilityEntry;
import com.carrental.rental.dto.PageResponse;
import com.carrental.rental.dto.VehicleEntry;
import com.carrental.rental.dto.VehicleFilterCriteria;
import com.carrental.rental.service.AvailabilityService;
import com.carrental.rental.service.UserService;
import com.carrental.rental.util.DateRange;
import com.carrental.rental.util.PaginationUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/v1/availability")
public class AvailabilityController {

    private final AvailabilityService availabilityService;
    private final UserService userService;

    @GetMapping
    public ResponseEntity<PageResponse<VehicleEntry>> search(
            @RequestHeader(RentalConstants.USER_ID_HEADER) Long userId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end,
            @RequestParam(required = false) String make,
            @RequestParam(required = false) String model,
            @RequestParam(required = false) Integer yearMin,
            @RequestParam(required = false) Integer yearMax,
            @RequestParam(required = false) BigDecimal maxDailyRate,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "" + RentalConstants.DEFAULT_PAGE_SIZE) int size) {

        log.info("GET /v1/availability: {} -> {}, make={}, model={}, page={}, size={}",
                start, end, make, model, page, size);

        Actor actor = userService.resolveActor(userId);
        VehicleFilterCriteria criteria = VehicleFilterCriteria.builder()
                .make(make)
                .model(model)
                .yearMin(yearMin)
                .yearMax(yearMax)
                .maxDailyRate(maxDailyRate)
                .build();

        List<VehicleEntry> results = availabilityService.search(actor, DateRange.of(start, end), criteria);
        return ResponseEntity.ok(PaginationUtils.paginate(results, page, size));
    }

    @GetMapping("/vehicles/{vehicleId}")
    public ResponseEntity<AvailabilityEntry> checkVehicle(
            @RequestHeader(RentalConstants.USER_ID_HEADER) Long userId,
            @PathVariable Long vehicleId,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate start,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate end) {

        log.debug("GET /v1/availability/vehicles/{}: {} -> {}", vehicleId, start, end);

        Actor actor = userService.resolveActor(userId);
        return ResponseEntity.ok(availabilityService.checkVehicle(actor, vehicleId, DateRange.of(start, end)));
    }
}
