package com.carrental.rental.controller.v1;

import com.carrental.rental.constants.RentalConstants;
import com.carrental.rental.dto.BookingEntry;
import com.carrental.rental.dto.BookingRequest;
import com.carrental.rental.dto.ChargeEntry;
import com.carrental.rental.dto.ChargeRequest;
import com.carrental.rental.dto.PageResponse;
import com.carrental.rental.dto.RejectRequest;
import com.carrental.rental.enums.BookingStatus;
import com.carrental.rental.service.BookingService;
import com.carrental.rental.service.UserService;
import com.carrental.rental.util.PaginationUtils;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/v1/bookings")
@RequiredArgsConstructor
@Slf4j
public class BookingController {

    private final BookingService bookingService;
    private final UserService userService;

    @PostMapping
    public ResponseEntity<BookingEntry> create(
            @RequestHeader(RentalConstants.USER_ID_HEADER) Long userId,
            @Valid @RequestBody BookingRequest request) {

        log.info("POST /v1/bookings - vehicle={}, range={}..{}, actor={}",
                request.getVehicleId(), request.getStartDate(), request.getEndDate(), userId);

        BookingEntry entry = bookingService.createBooking(userService.resolveActor(userId), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(entry);
    }

    @GetMapping("/{bookingId}")
    public ResponseEntity<BookingEntry> findById(
            @RequestHeader(RentalConstants.USER_ID_HEADER) Long userId,
            @PathVariable Long bookingId) {
        log.debug("GET /v1/bookings/{}", bookingId);
        return ResponseEntity.ok(bookingService.getBooking(userService.resolveActor(userId), bookingId));
    }

    @GetMapping("/user/{ownerId}")
    public ResponseEntity<List<BookingEntry>> findByUser(
            @RequestHeader(RentalConstants.USER_ID_HEADER) Long userId,
            @PathVariable Long ownerId) {
        log.debug("GET /v1/bookings/user/{}", ownerId);
        return ResponseEntity.ok(bookingService.listForUser(userService.resolveActor(userId), ownerId));
    }

    @GetMapping("/pending")
    public ResponseEntity<List<BookingEntry>> findPending(
            @RequestHeader(RentalConstants.USER_ID_HEADER) Long userId) {
        log.debug("GET /v1/bookings/pending");
        return ResponseEntity.ok(bookingService.listPending(userService.resolveActor(userId)));
    }

    @GetMapping
    public ResponseEntity<PageResponse<BookingEntry>> findAll(
            @RequestHeader(RentalConstants.USER_ID_HEADER) Long userId,
            @RequestParam(required = false) BookingStatus status,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "" + RentalConstants.DEFAULT_PAGE_SIZE) int size) {
        log.debug("GET /v1/bookings: status={}, page={}, size={}", status, page, size);

        Sort newestFirst = Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("id"));
        return ResponseEntity.ok(bookingService.listAll(
                userService.resolveActor(userId), status, PaginationUtils.pageable(page, size, newestFirst)));
    }

    @PostMapping("/{bookingId}/approve")
    public ResponseEntity<BookingEntry> approve(
            @RequestHeader(RentalConstants.USER_ID_HEADER) Long userId,
            @PathVariable Long bookingId) {
        log.info("POST /v1/bookings/{}/approve - actor={}", bookingId, userId);
        return ResponseEntity.ok(bookingService.approveBooking(userService.resolveActor(userId), bookingId));
    }

    @PostMapping("/{bookingId}/reject")
    public ResponseEntity<BookingEntry> reject(
            @RequestHeader(RentalConstants.USER_ID_HEADER) Long userId,
            @PathVariable Long bookingId,
            @RequestBody(required = false) RejectRequest request) {
        log.info("POST /v1/bookings/{}/reject - actor={}", bookingId, userId);

        String reason = request != null ? request.getReason() : null;
        return ResponseEntity.ok(bookingService.rejectBooking(userService.resolveActor(userId), bookingId, reason));
    }

    @PostMapping("/{bookingId}/charges")
    public ResponseEntity<BookingEntry> addCharge(
            @RequestHeader(RentalConstants.USER_ID_HEADER) Long userId,
            @PathVariable Long bookingId,
            @Valid @RequestBody ChargeRequest request) {
        log.info("POST /v1/bookings/{}/charges - code={}, amount={}", bookingId, request.getCode(), request.getAmount());

        BookingEntry entry = bookingService.addCharge(userService.resolveActor(userId), bookingId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(entry);
    }

    @GetMapping("/{bookingId}/charges")
    public ResponseEntity<List<ChargeEntry>> charges(
            @RequestHeader(RentalConstants.USER_ID_HEADER) Long userId,
            @PathVariable Long bookingId) {
        log.debug("GET /v1/bookings/{}/charges", bookingId);
        return ResponseEntity.ok(bookingService.getCharges(userService.resolveActor(userId), bookingId));
    }

    @PostMapping("/{bookingId}/recalculate")
    public ResponseEntity<BookingEntry> recalculate(
            @RequestHeader(RentalConstants.USER_ID_HEADER) Long userId,
            @PathVariable Long bookingId) {
        log.info("POST /v1/bookings/{}/recalculate", bookingId);
        return ResponseEntity.ok(bookingService.recalculateFee(userService.resolveActor(userId), bookingId));
    }
}
