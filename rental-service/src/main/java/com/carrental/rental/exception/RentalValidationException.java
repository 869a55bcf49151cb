package com.carrental.rental.exception;


public class RentalValidationException extends RentalException {

    private static final String ERROR_CODE = "VALIDATION_ERROR";

    public RentalValidationException(String message) {
        super(ERROR_CODE, message);
    }
}
