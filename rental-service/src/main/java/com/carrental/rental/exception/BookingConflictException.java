package com.carrental.rental.exception;

import lombok.Getter;

import java.util.List;

/**
 * Thrown at approval time when the booking overlaps an approved booking or a
 * maintenance window of the same vehicle. The booking stays pending.
 */
@Getter
public class BookingConflictException extends RentalException {

    private static final String ERROR_CODE = "BOOKING_CONFLICT";

    private final Long bookingId;
    private final List<Long> conflictingBookingIds;
    private final List<Long> conflictingMaintenanceIds;

    public BookingConflictException(Long bookingId, List<Long> conflictingBookingIds,
                                    List<Long> conflictingMaintenanceIds) {
        super(ERROR_CODE, buildMessage(bookingId, conflictingBookingIds, conflictingMaintenanceIds));
        this.bookingId = bookingId;
        this.conflictingBookingIds = List.copyOf(conflictingBookingIds);
        this.conflictingMaintenanceIds = List.copyOf(conflictingMaintenanceIds);
    }

    private static String buildMessage(Long bookingId, List<Long> bookings, List<Long> maintenance) {
        StringBuilder sb = new StringBuilder("Booking ").append(bookingId).append(" overlaps");
        if (!bookings.isEmpty()) {
            sb.append(" approved booking(s) ").append(bookings);
        }
        if (!maintenance.isEmpty()) {
            if (!bookings.isEmpty()) {
                sb.append(" and");
            }
            sb.append(" maintenance window(s) ").append(maintenance);
        }
        return sb.toString();
    }
}
