package com.carrental.rental.dto;

import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDate;

/**
 * Both fields are optional: a missing end date closes the window today.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class MaintenanceCloseRequest {

    LocalDate endDate;

    String notes;
}
