package com.carrental.rental.repository;

import com.carrental.rental.enums.BookingStatus;
import com.carrental.rental.model.Booking;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface BookingRepository extends JpaRepository<Booking, Long> {

    @Query("SELECT b FROM Booking b WHERE b.user.id = :userId ORDER BY b.createdAt DESC, b.id DESC")
    List<Booking> findByUserIdNewestFirst(@Param("userId") Long userId);

    @Query("SELECT b FROM Booking b WHERE b.status = :status ORDER BY b.createdAt ASC, b.id ASC")
    List<Booking> findByStatusOldestFirst(@Param("status") BookingStatus status);

    Page<Booking> findByStatus(BookingStatus status, Pageable pageable);

    /**
     * Bookings in {@code status} for the vehicle that intersect [start, end).
     */
    @Query("SELECT b FROM Booking b WHERE b.vehicle.id = :vehicleId AND b.status = :status " +
            "AND b.startDate < :end AND b.endDate > :start ORDER BY b.startDate ASC, b.id ASC")
    List<Booking> findOverlapping(
            @Param("vehicleId") Long vehicleId,
            @Param("status") BookingStatus status,
            @Param("start") LocalDate start,
            @Param("end") LocalDate end);

    @Query("SELECT b FROM Booking b WHERE b.vehicle.id = :vehicleId AND b.status = :status " +
            "AND b.endDate > :start ORDER BY b.startDate ASC, b.id ASC")
    List<Booking> findOverlappingFrom(
            @Param("vehicleId") Long vehicleId,
            @Param("status") BookingStatus status,
            @Param("start") LocalDate start);

    boolean existsByVehicle_Id(Long vehicleId);

    /**
     * Moves a booking out of {@code expected} only if it is still there.
     *
     * @return 1 when the transition happened, 0 when the booking had already left {@code expected}
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Booking b SET b.status = :target, b.updatedAt = :now " +
            "WHERE b.id = :id AND b.status = :expected")
    int transitionStatus(
            @Param("id") Long id,
            @Param("expected") BookingStatus expected,
            @Param("target") BookingStatus target,
            @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Booking b SET b.totalFee = :totalFee, b.updatedAt = :now WHERE b.id = :id")
    int updateTotalFee(
            @Param("id") Long id,
            @Param("totalFee") BigDecimal totalFee,
            @Param("now") LocalDateTime now);
}
