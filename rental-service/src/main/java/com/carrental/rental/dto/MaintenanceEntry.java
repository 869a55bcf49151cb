package com.carrental.rental.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MaintenanceEntry {

    Long id;
    Long vehicleId;
    String type;
    BigDecimal cost;
    LocalDate startDate;
    LocalDate endDate;
    String notes;
    boolean open;

    /** Approved bookings the window overlaps when it was opened. They are not cancelled. */
    List<Long> overlappingBookingIds;
}
