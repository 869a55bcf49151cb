package com.carrental.rental.exception;

import lombok.Getter;

@Getter
public class RentalException extends RuntimeException {

    private final String errorCode;

    public RentalException(String errorCode, String message) {
        this(errorCode, message, null);
    }

    public RentalException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
