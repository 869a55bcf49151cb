package com.carrental.rental.model;

import com.carrental.rental.enums.BookingStatus;
import com.carrental.rental.util.DateRange;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.FieldDefaults;
import org.hibernate.annotations.Check;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * A rental request for one vehicle over [startDate, endDate). Created pending and moved
 * to approved or rejected exactly once.
 */
@Entity
@Table(name = "bookings", indexes = {
        @Index(name = "idx_bk_car_status_dates", columnList = "car_id, status, start_date, end_date"),
        @Index(name = "idx_bk_user_created", columnList = "user_id, created_at")
})
@Check(constraints = "end_date > start_date AND rental_days > 0 AND status IN ('PENDING', 'APPROVED', 'REJECTED')")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class Booking {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "booking_id")
    Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false,
            foreignKey = @ForeignKey(name = "fk_bookings_user"))
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    User user;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "car_id", nullable = false,
            foreignKey = @ForeignKey(name = "fk_bookings_car"))
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    Vehicle vehicle;

    @Column(name = "start_date", nullable = false)
    LocalDate startDate;

    @Column(name = "end_date", nullable = false)
    LocalDate endDate;

    @Column(name = "rental_days", nullable = false)
    Integer rentalDays;

    @Column(name = "daily_rate", nullable = false, precision = 10, scale = 2)
    BigDecimal dailyRate;

    @Column(name = "total_fee", nullable = false, precision = 12, scale = 2)
    BigDecimal totalFee;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, columnDefinition = "VARCHAR(20)")
    @Builder.Default
    BookingStatus status = BookingStatus.PENDING;

    @Column(name = "created_at", nullable = false, updatable = false)
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

    public DateRange range() {
        return DateRange.of(startDate, endDate);
    }

    public boolean isPending() {
        return status == BookingStatus.PENDING;
    }
}
