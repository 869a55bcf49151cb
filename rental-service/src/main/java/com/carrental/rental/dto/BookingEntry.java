package com.carrental.rental.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class BookingEntry {

    Long id;
    Long userId;
    Long vehicleId;
    LocalDate startDate;
    LocalDate endDate;
    Integer rentalDays;
    BigDecimal dailyRate;
    BigDecimal totalFee;
    String status;
    LocalDateTime createdAt;
    LocalDateTime updatedAt;

    /** Soft-check findings at creation time; they never block the request. */
    List<String> warnings;
}
