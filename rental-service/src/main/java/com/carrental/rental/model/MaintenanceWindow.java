package com.carrental.rental.model;

import com.carrental.rental.util.DateRange;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.FieldDefaults;
import org.hibernate.annotations.Check;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A period the vehicle spends in the shop. {@code endDate} is inclusive; a null end
 * keeps the window open and blocks the vehicle indefinitely.
 */
@Entity
@Table(name = "maintenance", indexes = {
        @Index(name = "idx_m_car_dates", columnList = "car_id, start_date, end_date")
})
@Check(constraints = "cost >= 0 AND (end_date IS NULL OR end_date >= start_date)")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class MaintenanceWindow {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "maint_id")
    Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "car_id", nullable = false,
            foreignKey = @ForeignKey(name = "fk_maintenance_car"))
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    Vehicle vehicle;

    @Column(name = "type", nullable = false, length = 60)
    String type;

    @Column(name = "cost", nullable = false, precision = 10, scale = 2)
    @Builder.Default
    BigDecimal cost = BigDecimal.ZERO;

    @Column(name = "start_date", nullable = false)
    LocalDate startDate;

    @Column(name = "end_date")
    LocalDate endDate;

    @Column(name = "notes", length = 1000)
    String notes;

    public boolean isOpen() {
        return endDate == null;
    }

    public DateRange coverage() {
        return DateRange.inclusive(startDate, endDate);
    }
}
