package com.carrental.rental.mapper;

import com.carrental.rental.constants.RentalConstants;
import com.carrental.rental.dto.VehicleEntry;
import com.carrental.rental.model.Vehicle;

import java.util.ArrayList;
import java.util.List;

public final class VehicleMapper {

    private VehicleMapper() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static VehicleEntry toEntry(Vehicle vehicle) {
        if (vehicle == null) {
            return null;
        }

        return VehicleEntry.builder()
                .id(vehicle.getId())
                .make(vehicle.getMake())
                .model(vehicle.getModel())
                .year(vehicle.getYear())
                .color(vehicle.getColor())
                .mileage(vehicle.getMileage())
                .dailyRate(vehicle.getDailyRate())
                .availableNow(vehicle.getAvailableNow())
                .minRentDays(vehicle.getMinRentDays())
                .maxRentDays(vehicle.getMaxRentDays())
                .createdAt(vehicle.getCreatedAt())
                .updatedAt(vehicle.getUpdatedAt())
                .build();
    }

    public static List<VehicleEntry> toEntryList(List<Vehicle> vehicles) {
        if (vehicles == null || vehicles.isEmpty()) {
            return new ArrayList<>();
        }

        List<VehicleEntry> result = new ArrayList<>(vehicles.size());
        for (Vehicle vehicle : vehicles) {
            result.add(toEntry(vehicle));
        }
        return result;
    }

    public static Vehicle toEntity(VehicleEntry entry) {
        if (entry == null) {
            return null;
        }

        return Vehicle.builder()
                .make(entry.getMake().trim())
                .model(entry.getModel().trim())
                .year(entry.getYear())
                .color(entry.getColor().trim())
                .mileage(entry.getMileage() != null ? entry.getMileage() : 0)
                .dailyRate(entry.getDailyRate())
                .availableNow(entry.getAvailableNow() != null ? entry.getAvailableNow() : Boolean.TRUE)
                .minRentDays(entry.getMinRentDays() != null
                        ? entry.getMinRentDays() : RentalConstants.DEFAULT_MIN_RENT_DAYS)
                .maxRentDays(entry.getMaxRentDays() != null
                        ? entry.getMaxRentDays() : RentalConstants.DEFAULT_MAX_RENT_DAYS)
                .build();
    }

    /**
     * Copies the non-null fields of {@code entry} onto {@code vehicle}.
     */
    public static void updateEntity(Vehicle vehicle, VehicleEntry entry) {
        if (vehicle == null || entry == null) {
            return;
        }

        if (entry.getMake() != null) {
            vehicle.setMake(entry.getMake().trim());
        }
        if (entry.getModel() != null) {
            vehicle.setModel(entry.getModel().trim());
        }
        if (entry.getYear() != null) {
            vehicle.setYear(entry.getYear());
        }
        if (entry.getColor() != null) {
            vehicle.setColor(entry.getColor().trim());
        }
        if (entry.getMileage() != null) {
            vehicle.setMileage(entry.getMileage());
        }
        if (entry.getDailyRate() != null) {
            vehicle.setDailyRate(entry.getDailyRate());
        }
        if (entry.getAvailableNow() != null) {
            vehicle.setAvailableNow(entry.getAvailableNow());
        }
        if (entry.getMinRentDays() != null) {
            vehicle.setMinRentDays(entry.getMinRentDays());
        }
        if (entry.getMaxRentDays() != null) {
            vehicle.setMaxRentDays(entry.getMaxRentDays());
        }
    }
}
