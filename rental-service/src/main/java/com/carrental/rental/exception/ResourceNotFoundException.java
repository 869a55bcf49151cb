package com.carrental.rental.exception;

/**
 * Thrown when a referenced vehicle, booking, user or maintenance window does not exist.
 */
public class ResourceNotFoundException extends RentalException {

    private ResourceNotFoundException(String errorCode, String message) {
        super(errorCode, message);
    }

    public static ResourceNotFoundException vehicle(Long vehicleId) {
        return new ResourceNotFoundException("VEHICLE_NOT_FOUND", "Vehicle not found: " + vehicleId);
    }

    public static ResourceNotFoundException booking(Long bookingId) {
        return new ResourceNotFoundException("BOOKING_NOT_FOUND", "Booking not found: " + bookingId);
    }

    public static ResourceNotFoundException user(Long userId) {
        return new ResourceNotFoundException("USER_NOT_FOUND", "User not found: " + userId);
    }

    public static ResourceNotFoundException userByEmail(String email) {
        return new ResourceNotFoundException("USER_NOT_FOUND", "No user registered with email: " + email);
    }

    public static ResourceNotFoundException maintenance(Long windowId) {
        return new ResourceNotFoundException("MAINTENANCE_NOT_FOUND", "Maintenance window not found: " + windowId);
    }
}
