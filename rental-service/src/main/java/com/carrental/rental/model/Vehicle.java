package com.carrental.rental.model;

import com.carrental.rental.constants.RentalConstants;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.FieldDefaults;
import org.hibernate.annotations.Check;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Entity
@Table(name = "cars", indexes = {
        @Index(name = "idx_cars_available", columnList = "available_now"),
        @Index(name = "idx_cars_make_model", columnList = "make, model")
})
@Check(constraints = "daily_rate > 0 AND mileage >= 0 AND min_rent_days >= 1 AND max_rent_days >= min_rent_days")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class Vehicle {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "car_id")
    Long id;

    @Column(name = "make", nullable = false, length = 60)
    String make;

    @Column(name = "model", nullable = false, length = 60)
    String model;

    @Column(name = "model_year", nullable = false)
    Integer year;

    @Column(name = "color", nullable = false, length = 30)
    String color;

    @Column(name = "mileage", nullable = false)
    @Builder.Default
    Integer mileage = 0;

    @Column(name = "daily_rate", nullable = false, precision = 10, scale = 2)
    BigDecimal dailyRate;

    @Column(name = "available_now", nullable = false)
    @Builder.Default
    Boolean availableNow = Boolean.TRUE;

    @Column(name = "min_rent_days", nullable = false)
    @Builder.Default
    Integer minRentDays = RentalConstants.DEFAULT_MIN_RENT_DAYS;

    @Column(name = "max_rent_days", nullable = false)
    @Builder.Default
    Integer maxRentDays = RentalConstants.DEFAULT_MAX_RENT_DAYS;

    @Column(name = "created_at", updatable = false)
    LocalDateTime createdAt;

    @Column(name = "updated_at")
    LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public boolean acceptsDuration(int days) {
        return days >= minRentDays && days <= maxRentDays;
    }

    public String label() {
        return year + " " + make + " " + model;
    }
}
