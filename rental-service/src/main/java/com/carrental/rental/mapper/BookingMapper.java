package com.carrental.rental.mapper;

import com.carrental.rental.dto.BookingEntry;
import com.carrental.rental.dto.ChargeEntry;
import com.carrental.rental.model.Booking;
import com.carrental.rental.model.BookingCharge;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class BookingMapper {

    public BookingEntry toEntry(Booking booking, List<String> warnings) {
        if (booking == null) {
            return null;
        }

        return BookingEntry.builder()
                .id(booking.getId())
                .userId(booking.getUser() != null ? booking.getUser().getId() : null)
                .vehicleId(booking.getVehicle() != null ? booking.getVehicle().getId() : null)
                .startDate(booking.getStartDate())
                .endDate(booking.getEndDate())
                .rentalDays(booking.getRentalDays())
                .dailyRate(booking.getDailyRate())
                .totalFee(booking.getTotalFee())
                .status(booking.getStatus().name())
                .createdAt(booking.getCreatedAt())
                .updatedAt(booking.getUpdatedAt())
                .warnings(warnings)
                .build();
    }

    public BookingEntry toEntry(Booking booking) {
        return toEntry(booking, null);
    }

    public List<BookingEntry> toEntryList(List<Booking> bookings) {
        return bookings.stream().map(this::toEntry).toList();
    }

    public ChargeEntry toChargeEntry(BookingCharge charge) {
        return ChargeEntry.builder()
                .id(charge.getId())
                .bookingId(charge.getBooking() != null ? charge.getBooking().getId() : null)
                .code(charge.getCode())
                .amount(charge.getAmount())
                .build();
    }

    public List<ChargeEntry> toChargeEntryList(List<BookingCharge> charges) {
        return charges.stream().map(this::toChargeEntry).toList();
    }
}
