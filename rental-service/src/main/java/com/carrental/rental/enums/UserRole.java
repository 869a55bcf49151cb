package com.carrental.rental.enums;

public enum UserRole {
    CUSTOMER,
    ADMIN
}
