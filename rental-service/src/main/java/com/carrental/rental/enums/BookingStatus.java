package com.carrental.rental.enums;

public enum BookingStatus {
    PENDING,
    APPROVED,
    REJECTED
}
