package com.carrental.rental.mapper;

import com.carrental.rental.dto.MaintenanceEntry;
import com.carrental.rental.model.MaintenanceWindow;

import java.util.ArrayList;
import java.util.List;

public final class MaintenanceMapper {

    private MaintenanceMapper() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static MaintenanceEntry toEntry(MaintenanceWindow window) {
        return toEntry(window, null);
    }

    public static MaintenanceEntry toEntry(MaintenanceWindow window, List<Long> overlappingBookingIds) {
        if (window == null) {
            return null;
        }

        return MaintenanceEntry.builder()
                .id(window.getId())
                .vehicleId(window.getVehicle() != null ? window.getVehicle().getId() : null)
                .type(window.getType())
                .cost(window.getCost())
                .startDate(window.getStartDate())
                .endDate(window.getEndDate())
                .notes(window.getNotes())
                .open(window.isOpen())
                .overlappingBookingIds(overlappingBookingIds)
                .build();
    }

    public static List<MaintenanceEntry> toEntryList(List<MaintenanceWindow> windows) {
        List<MaintenanceEntry> result = new ArrayList<>(windows.size());
        for (MaintenanceWindow window : windows) {
            result.add(toEntry(window));
        }
        return result;
    }
}
