package com.carrental.rental.exception;

/**
 * Thrown when a date range is empty or reversed, or its length falls outside
 * the vehicle's rental-day bounds.
 */
public class InvalidRangeException extends RentalException {

    private static final String ERROR_CODE = "INVALID_RANGE";

    public InvalidRangeException(String message) {
        super(ERROR_CODE, message);
    }

    public static InvalidRangeException belowMinimum(int days, int minDays) {
        return new InvalidRangeException(
                "Rental of " + days + " day(s) is below the minimum of " + minDays + " day(s)");
    }

    public static InvalidRangeException aboveMaximum(int days, int maxDays) {
        return new InvalidRangeException(
                "Rental of " + days + " day(s) exceeds the maximum of " + maxDays + " day(s)");
    }
}
