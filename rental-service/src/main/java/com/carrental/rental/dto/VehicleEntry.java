package com.carrental.rental.dto;

import com.carrental.rental.constants.RentalConstants;
import com.carrental.rental.constants.ValidationMessages;
import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VehicleEntry {

    Long id;

    @NotBlank(message = ValidationMessages.MAKE_REQUIRED)
    String make;

    @NotBlank(message = ValidationMessages.MODEL_REQUIRED)
    String model;

    @NotNull(message = ValidationMessages.YEAR_REQUIRED)
    @Min(value = RentalConstants.MIN_VEHICLE_YEAR, message = ValidationMessages.YEAR_MIN)
    Integer year;

    @NotBlank(message = ValidationMessages.COLOR_REQUIRED)
    String color;

    @Min(value = 0, message = ValidationMessages.MILEAGE_NON_NEGATIVE)
    Integer mileage;

    @NotNull(message = ValidationMessages.DAILY_RATE_REQUIRED)
    @DecimalMin(value = "0.00", inclusive = false, message = ValidationMessages.DAILY_RATE_POSITIVE)
    BigDecimal dailyRate;

    Boolean availableNow;

    @Min(value = 1, message = ValidationMessages.MIN_RENT_DAYS_MIN)
    Integer minRentDays;

    @Min(value = 1, message = ValidationMessages.MAX_RENT_DAYS_MIN)
    Integer maxRentDays;

    LocalDateTime createdAt;

    LocalDateTime updatedAt;
}
