package com.carrental.rental.repository;

import com.carrental.rental.dto.VehicleFilterCriteria;
import com.carrental.rental.model.Vehicle;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;

public final class VehicleSpecification {

    private VehicleSpecification() {
    }

    public static Specification<Vehicle> withCriteria(VehicleFilterCriteria criteria) {
        return Specification
                .where(makeContains(criteria.getMake()))
                .and(modelContains(criteria.getModel()))
                .and(yearAtLeast(criteria.getYearMin()))
                .and(yearAtMost(criteria.getYearMax()))
                .and(hasAvailability(criteria.getAvailable()))
                .and(dailyRateAtMost(criteria.getMaxDailyRate()));
    }

    /**
     * On-market vehicles whose rental-day bounds accept {@code days}, narrowed by the criteria.
     */
    public static Specification<Vehicle> candidatesFor(int days, VehicleFilterCriteria criteria) {
        return withCriteria(criteria)
                .and(hasAvailability(Boolean.TRUE))
                .and(acceptsDuration(days));
    }

    public static Specification<Vehicle> makeContains(String make) {
        return (root, query, cb) -> {
            if (!StringUtils.hasText(make)) {
                return null;
            }
            return cb.like(cb.lower(root.get("make")), "%" + make.trim().toLowerCase() + "%");
        };
    }

    public static Specification<Vehicle> modelContains(String model) {
        return (root, query, cb) -> {
            if (!StringUtils.hasText(model)) {
                return null;
            }
            return cb.like(cb.lower(root.get("model")), "%" + model.trim().toLowerCase() + "%");
        };
    }

    public static Specification<Vehicle> yearAtLeast(Integer yearMin) {
        return (root, query, cb) -> {
            if (yearMin == null) {
                return null;
            }
            return cb.greaterThanOrEqualTo(root.get("year"), yearMin);
        };
    }

    public static Specification<Vehicle> yearAtMost(Integer yearMax) {
        return (root, query, cb) -> {
            if (yearMax == null) {
                return null;
            }
            return cb.lessThanOrEqualTo(root.get("year"), yearMax);
        };
    }

    public static Specification<Vehicle> hasAvailability(Boolean available) {
        return (root, query, cb) -> {
            if (available == null) {
                return null;
            }
            return cb.equal(root.get("availableNow"), available);
        };
    }

    public static Specification<Vehicle> dailyRateAtMost(BigDecimal maxDailyRate) {
        return (root, query, cb) -> {
            if (maxDailyRate == null) {
                return null;
            }
            return cb.lessThanOrEqualTo(root.get("dailyRate"), maxDailyRate);
        };
    }

    public static Specification<Vehicle> acceptsDuration(int days) {
        return (root, query, cb) -> cb.and(
                cb.lessThanOrEqualTo(root.get("minRentDays"), days),
                cb.greaterThanOrEqualTo(root.get("maxRentDays"), days));
    }
}
