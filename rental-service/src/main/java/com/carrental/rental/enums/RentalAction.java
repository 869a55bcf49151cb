package com.carrental.rental.enums;

/**
 * Operations gated by {@link com.carrental.rental.access.AccessPolicy}.
 */
public enum RentalAction {
    SEARCH_AVAILABILITY,
    VIEW_FLEET,
    CREATE_BOOKING,
    VIEW_OWN_BOOKINGS,
    CREATE_BOOKING_ON_BEHALF,
    VIEW_ALL_BOOKINGS,
    APPROVE_BOOKING,
    REJECT_BOOKING,
    ADD_CHARGE,
    MANAGE_FLEET,
    MANAGE_MAINTENANCE
}
