package com.carrental.rental.exception;

public class AccessDeniedException extends RentalException {

    private static final String ERROR_CODE = "FORBIDDEN";

    public AccessDeniedException(String message) {
        super(ERROR_CODE, message);
    }
}
