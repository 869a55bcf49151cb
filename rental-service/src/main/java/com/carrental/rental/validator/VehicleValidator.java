package com.carrental.rental.validator;

import com.carrental.rental.constants.RentalConstants;
import com.carrental.rental.constants.ValidationMessages;
import com.carrental.rental.dto.VehicleEntry;
import com.carrental.rental.exception.RentalValidationException;
import com.carrental.rental.model.Vehicle;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;

public final class VehicleValidator {

    private VehicleValidator() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static void validateNewVehicle(VehicleEntry entry) {
        if (entry == null) {
            throw new RentalValidationException(ValidationMessages.VEHICLE_DATA_REQUIRED);
        }
        requireText(entry.getMake(), ValidationMessages.MAKE_REQUIRED);
        requireText(entry.getModel(), ValidationMessages.MODEL_REQUIRED);
        requireText(entry.getColor(), ValidationMessages.COLOR_REQUIRED);
        if (entry.getYear() == null) {
            throw new RentalValidationException(ValidationMessages.YEAR_REQUIRED);
        }
        if (entry.getDailyRate() == null) {
            throw new RentalValidationException(ValidationMessages.DAILY_RATE_REQUIRED);
        }
    }

    /**
     * Checks the stored invariants on a vehicle about to be persisted.
     */
    public static void validateVehicle(Vehicle vehicle) {
        if (vehicle.getYear() < RentalConstants.MIN_VEHICLE_YEAR) {
            throw new RentalValidationException(ValidationMessages.YEAR_MIN);
        }
        if (vehicle.getMileage() < 0) {
            throw new RentalValidationException(ValidationMessages.MILEAGE_NON_NEGATIVE);
        }
        if (vehicle.getDailyRate().compareTo(BigDecimal.ZERO) <= 0) {
            throw new RentalValidationException(ValidationMessages.DAILY_RATE_POSITIVE);
        }
        validateRentDays(vehicle.getMinRentDays(), vehicle.getMaxRentDays());
    }

    public static void validateRentDays(int minRentDays, int maxRentDays) {
        if (minRentDays < 1) {
            throw new RentalValidationException(ValidationMessages.MIN_RENT_DAYS_MIN);
        }
        if (maxRentDays < 1) {
            throw new RentalValidationException(ValidationMessages.MAX_RENT_DAYS_MIN);
        }
        if (maxRentDays < minRentDays) {
            throw new RentalValidationException(ValidationMessages.RENT_DAYS_ORDER);
        }
    }

    public static void validateVehicleId(Long vehicleId) {
        if (vehicleId == null) {
            throw new RentalValidationException(ValidationMessages.VEHICLE_ID_REQUIRED);
        }
    }

    private static void requireText(String value, String message) {
        if (!StringUtils.hasText(value)) {
            throw new RentalValidationException(message);
        }
    }
}
