package com.carrental.rental.dto;

import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDate;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class AvailabilityEntry {

    Long vehicleId;
    LocalDate startDate;
    LocalDate endDate;
    boolean available;
    List<Long> conflictingBookingIds;
    List<Long> conflictingMaintenanceIds;
}
