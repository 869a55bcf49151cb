package com.carrental.rental.dto;

import java.util.ArrayList;
import java.util.List;

/**
 * Approved bookings and maintenance windows that overlap a requested range on one vehicle.
 */
public record ConflictReport(List<Long> bookingIds, List<Long> maintenanceIds) {

    public ConflictReport {
        bookingIds = List.copyOf(bookingIds);
        maintenanceIds = List.copyOf(maintenanceIds);
    }

    public static ConflictReport none() {
        return new ConflictReport(List.of(), List.of());
    }

    public boolean isEmpty() {
        return bookingIds.isEmpty() && maintenanceIds.isEmpty();
    }

    public List<String> toWarnings() {
        List<String> warnings = new ArrayList<>();
        for (Long id : bookingIds) {
            warnings.add("Overlaps approved booking " + id);
        }
        for (Long id : maintenanceIds) {
            warnings.add("Overlaps maintenance window " + id);
        }
        return warnings;
    }
}
