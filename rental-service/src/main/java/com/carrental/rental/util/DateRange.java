package com.carrental.rental.util;

import com.carrental.rental.constants.ValidationMessages;
import com.carrental.rental.exception.InvalidRangeException;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Half-open interval [start, end) of calendar dates. A null end means the range
 * is unbounded (an open maintenance window).
 *
 * <p>A booking's end date is its return date, so a booking ending on day D and
 * another starting on day D do not overlap. An inclusive maintenance window
 * [s, e] is represented as [s, e + 1).
 */
public record DateRange(LocalDate start, LocalDate end) {

    public DateRange {
        if (start == null) {
            throw new InvalidRangeException(ValidationMessages.START_DATE_REQUIRED);
        }
        if (end != null && !end.isAfter(start)) {
            throw new InvalidRangeException(ValidationMessages.END_AFTER_START);
        }
    }

    public static DateRange of(LocalDate start, LocalDate end) {
        if (end == null) {
            throw new InvalidRangeException(ValidationMessages.END_DATE_REQUIRED);
        }
        return new DateRange(start, end);
    }

    public static DateRange from(LocalDate start) {
        return new DateRange(start, null);
    }

    /**
     * Maps an inclusive [start, end] pair onto a half-open range; a null end stays unbounded.
     */
    public static DateRange inclusive(LocalDate start, LocalDate endInclusive) {
        if (endInclusive != null && endInclusive.isBefore(start)) {
            throw new InvalidRangeException(ValidationMessages.MAINTENANCE_END_BEFORE_START);
        }
        return new DateRange(start, endInclusive == null ? null : endInclusive.plusDays(1));
    }

    public static boolean overlaps(DateRange a, DateRange b) {
        return a.start.isBefore(b.endOrMax()) && b.start.isBefore(a.endOrMax());
    }

    public boolean overlaps(DateRange other) {
        return overlaps(this, other);
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(start) && date.isBefore(endOrMax());
    }

    public boolean isUnbounded() {
        return end == null;
    }

    public int durationDays() {
        if (end == null) {
            throw new InvalidRangeException(ValidationMessages.UNBOUNDED_DURATION);
        }
        long days = ChronoUnit.DAYS.between(start, end);
        if (days > Integer.MAX_VALUE) {
            throw new InvalidRangeException(ValidationMessages.RANGE_TOO_LONG);
        }
        return (int) days;
    }

    private LocalDate endOrMax() {
        return end == null ? LocalDate.MAX : end;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + (end == null ? "open" : end) + ")";
    }
}
