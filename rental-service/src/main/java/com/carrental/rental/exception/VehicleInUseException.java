package com.carrental.rental.exception;

/**
 * Thrown when deleting a vehicle that bookings or maintenance records still reference.
 */
public class VehicleInUseException extends RentalException {

    private static final String ERROR_CODE = "VEHICLE_IN_USE";

    public VehicleInUseException(Long vehicleId) {
        super(ERROR_CODE, "Vehicle is referenced by bookings or maintenance records: " + vehicleId);
    }
}
