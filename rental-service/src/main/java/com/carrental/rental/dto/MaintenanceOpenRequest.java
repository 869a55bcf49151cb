package com.carrental.rental.dto;

import com.carrental.rental.constants.ValidationMessages;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class MaintenanceOpenRequest {

    @NotNull(message = ValidationMessages.VEHICLE_ID_REQUIRED)
    Long vehicleId;

    @NotBlank(message = ValidationMessages.MAINTENANCE_TYPE_REQUIRED)
    String type;

    @NotNull(message = ValidationMessages.START_DATE_REQUIRED)
    LocalDate startDate;

    @DecimalMin(value = "0.00", message = ValidationMessages.COST_NON_NEGATIVE)
    BigDecimal cost;

    String notes;
}
