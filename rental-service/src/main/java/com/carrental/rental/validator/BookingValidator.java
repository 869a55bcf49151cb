package com.carrental.rental.validator;

import com.carrental.rental.constants.ValidationMessages;
import com.carrental.rental.dto.BookingRequest;
import com.carrental.rental.dto.ChargeRequest;
import com.carrental.rental.exception.InvalidRangeException;
import com.carrental.rental.exception.RentalValidationException;
import com.carrental.rental.model.Vehicle;
import com.carrental.rental.util.DateRange;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.util.List;

public final class BookingValidator {

    private BookingValidator() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Validates the request shape and returns its date range.
     */
    public static DateRange validateRequest(BookingRequest request) {
        if (request == null) {
            throw new RentalValidationException(ValidationMessages.BOOKING_REQUEST_REQUIRED);
        }
        VehicleValidator.validateVehicleId(request.getVehicleId());
        DateRange range = DateRange.of(request.getStartDate(), request.getEndDate());
        validateExtras(request.getExtras());
        return range;
    }

    public static void validateRentalDays(Vehicle vehicle, int days) {
        if (days < vehicle.getMinRentDays()) {
            throw InvalidRangeException.belowMinimum(days, vehicle.getMinRentDays());
        }
        if (days > vehicle.getMaxRentDays()) {
            throw InvalidRangeException.aboveMaximum(days, vehicle.getMaxRentDays());
        }
    }

    public static void validateExtras(List<ChargeRequest> extras) {
        if (extras == null) {
            return;
        }
        for (ChargeRequest extra : extras) {
            if (extra == null) {
                throw new RentalValidationException(ValidationMessages.CHARGE_CODE_REQUIRED);
            }
            validateCharge(extra.getCode(), extra.getAmount());
        }
    }

    public static void validateCharge(String code, BigDecimal amount) {
        if (!StringUtils.hasText(code)) {
            throw new RentalValidationException(ValidationMessages.CHARGE_CODE_REQUIRED);
        }
        if (amount == null) {
            throw new RentalValidationException(ValidationMessages.CHARGE_AMOUNT_REQUIRED);
        }
        if (amount.compareTo(BigDecimal.ZERO) <= 0) {
            throw new RentalValidationException(ValidationMessages.CHARGE_AMOUNT_POSITIVE);
        }
    }

    public static void validateBookingId(Long bookingId) {
        if (bookingId == null) {
            throw new RentalValidationException(ValidationMessages.BOOKING_ID_REQUIRED);
        }
    }
}
