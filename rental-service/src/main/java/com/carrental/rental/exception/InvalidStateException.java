package com.carrental.rental.exception;

public class InvalidStateException extends RentalException {

    private static final String ERROR_CODE = "INVALID_STATE";

    public InvalidStateException(String message) {
        super(ERROR_CODE, message);
    }

    public static InvalidStateException notPending(Long bookingId, Object status, String operation) {
        return new InvalidStateException(
                "Only pending bookings can be " + operation + "; booking " + bookingId + " is " + status);
    }
}
