package com.carrental.rental.repository;

import com.carrental.rental.model.MaintenanceWindow;
import org.springframework.data.jpa.domain.Specification;

public final class MaintenanceSpecification {

    private MaintenanceSpecification() {
    }

    /**
     * @param activeOnly true for open windows, false for closed ones, null for both
     */
    public static Specification<MaintenanceWindow> withFilters(Boolean activeOnly, Long vehicleId) {
        return Specification
                .where(hasActiveState(activeOnly))
                .and(forVehicle(vehicleId));
    }

    public static Specification<MaintenanceWindow> hasActiveState(Boolean activeOnly) {
        return (root, query, cb) -> {
            if (activeOnly == null) {
                return null;
            }
            return activeOnly ? cb.isNull(root.get("endDate")) : cb.isNotNull(root.get("endDate"));
        };
    }

    public static Specification<MaintenanceWindow> forVehicle(Long vehicleId) {
        return (root, query, cb) -> {
            if (vehicleId == null) {
                return null;
            }
            return cb.equal(root.get("vehicle").get("id"), vehicleId);
        };
    }
}
