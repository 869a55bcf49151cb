package com.carrental.rental.repository;

import com.carrental.rental.model.BookingCharge;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;

@Repository
public interface BookingChargeRepository extends JpaRepository<BookingCharge, Long> {

    @Query("SELECT c FROM BookingCharge c WHERE c.booking.id = :bookingId ORDER BY c.id ASC")
    List<BookingCharge> findByBookingId(@Param("bookingId") Long bookingId);

    @Query("SELECT SUM(c.amount) FROM BookingCharge c WHERE c.booking.id = :bookingId")
    BigDecimal sumAmountByBookingId(@Param("bookingId") Long bookingId);
}
