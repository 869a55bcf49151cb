package com.carrental.rental.exception;

/**
 * Thrown when an administrator has taken the vehicle off the market.
 */
public class VehicleUnavailableException extends RentalException {

    private static final String ERROR_CODE = "VEHICLE_UNAVAILABLE";

    public VehicleUnavailableException(Long vehicleId) {
        super(ERROR_CODE, "Vehicle is not available for booking: " + vehicleId);
    }
}
