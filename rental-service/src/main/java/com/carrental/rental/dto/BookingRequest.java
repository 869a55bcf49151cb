package com.carrental.rental.dto;

import com.carrental.rental.constants.ValidationMessages;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * {@code userId} and {@code customerEmail} name the booking owner when an admin books on
 * behalf of a customer; both are left empty when a customer books for themselves.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class BookingRequest {

    @NotNull(message = ValidationMessages.VEHICLE_ID_REQUIRED)
    Long vehicleId;

    @NotNull(message = ValidationMessages.START_DATE_REQUIRED)
    LocalDate startDate;

    @NotNull(message = ValidationMessages.END_DATE_REQUIRED)
    LocalDate endDate;

    Long userId;

    String customerEmail;

    @Valid
    @Builder.Default
    List<ChargeRequest> extras = new ArrayList<>();
}
