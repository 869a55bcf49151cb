package com.carrental.rental.validator;

import com.carrental.rental.constants.ValidationMessages;
import com.carrental.rental.dto.MaintenanceOpenRequest;
import com.carrental.rental.exception.InvalidRangeException;
import com.carrental.rental.exception.RentalValidationException;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.time.LocalDate;

public final class MaintenanceValidator {

    private MaintenanceValidator() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static void validateOpenRequest(MaintenanceOpenRequest request) {
        if (request == null) {
            throw new RentalValidationException(ValidationMessages.MAINTENANCE_TYPE_REQUIRED);
        }
        VehicleValidator.validateVehicleId(request.getVehicleId());
        if (!StringUtils.hasText(request.getType())) {
            throw new RentalValidationException(ValidationMessages.MAINTENANCE_TYPE_REQUIRED);
        }
        if (request.getStartDate() == null) {
            throw new InvalidRangeException(ValidationMessages.START_DATE_REQUIRED);
        }
        if (request.getCost() != null && request.getCost().compareTo(BigDecimal.ZERO) < 0) {
            throw new RentalValidationException(ValidationMessages.COST_NON_NEGATIVE);
        }
    }

    public static void validateCloseDate(LocalDate startDate, LocalDate endDate) {
        if (endDate.isBefore(startDate)) {
            throw new InvalidRangeException(ValidationMessages.MAINTENANCE_END_BEFORE_START);
        }
    }
}
