package com.carrental.rental.service;

import com.carrental.rental.access.Actor;
import com.carrental.rental.dto.BookingEntry;
import com.carrental.rental.dto.BookingRequest;
import com.carrental.rental.dto.ChargeRequest;
import com.carrental.rental.dto.ConflictReport;
import com.carrental.rental.enums.BookingStatus;
import com.carrental.rental.enums.UserRole;
import com.carrental.rental.exception.AccessDeniedException;
import com.carrental.rental.exception.BookingConflictException;
import com.carrental.rental.exception.InvalidRangeException;
import com.carrental.rental.exception.InvalidStateException;
import com.carrental.rental.exception.ResourceNotFoundException;
import com.carrental.rental.exception.RentalValidationException;
import com.carrental.rental.exception.VehicleUnavailableException;
import com.carrental.rental.mapper.BookingMapper;
import com.carrental.rental.model.Booking;
import com.carrental.rental.model.BookingCharge;
import com.carrental.rental.model.User;
import com.carrental.rental.model.Vehicle;
import com.carrental.rental.repository.BookingChargeRepository;
import com.carrental.rental.repository.BookingRepository;
import com.carrental.rental.util.DateRange;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.SimpleTransactionStatus;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("BookingService Unit Tests")
class BookingServiceTest {

    @Mock
    private BookingRepository bookingRepository;

    @Mock
    private BookingChargeRepository chargeRepository;

    @Mock
    private FleetService fleetService;

    @Mock
    private UserService userService;

    @Mock
    private AvailabilityService availabilityService;

    @Mock
    private AvailabilityCacheService cacheService;

    @Mock
    private PlatformTransactionManager transactionManager;

    private SimpleMeterRegistry meterRegistry;
    private BookingService bookingService;

    private User customer;
    private User otherCustomer;
    private Vehicle vehicle;
    private Booking pendingBooking;

    private final Actor admin = Actor.admin(1L);
    private final Actor customerActor = Actor.customer(2L);

    private static LocalDate jan(int day) {
        return LocalDate.of(2025, 1, day);
    }

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        when(transactionManager.getTransaction(any())).thenReturn(new SimpleTransactionStatus());

        bookingService = new BookingService(bookingRepository, chargeRepository, fleetService, userService,
                availabilityService, cacheService, new PricingService(), new BookingMapper(),
                meterRegistry, transactionManager);

        customer = User.builder().id(2L).email("alice@example.com").fullName("Alice").role(UserRole.CUSTOMER).build();
        otherCustomer = User.builder().id(3L).email("bob@example.com").fullName("Bob").role(UserRole.CUSTOMER).build();

        vehicle = Vehicle.builder()
                .id(10L)
                .make("Honda")
                .model("Civic")
                .year(2022)
                .color("Grey")
                .dailyRate(new BigDecimal("50.00"))
                .build();

        pendingBooking = Booking.builder()
                .id(100L)
                .user(customer)
                .vehicle(vehicle)
                .startDate(jan(5))
                .endDate(jan(10))
                .rentalDays(5)
                .dailyRate(new BigDecimal("50.00"))
                .totalFee(new BigDecimal("250.00"))
                .status(BookingStatus.PENDING)
                .build();

        when(userService.findUserOrThrow(2L)).thenReturn(customer);
        when(userService.findUserOrThrow(3L)).thenReturn(otherCustomer);
        when(fleetService.findVehicleOrThrow(10L)).thenReturn(vehicle);
        when(bookingRepository.save(any(Booking.class))).thenAnswer(inv -> {
            Booking saved = inv.getArgument(0);
            saved.setId(200L);
            return saved;
        });
        when(availabilityService.findConflicts(anyLong(), any(DateRange.class), any()))
                .thenReturn(ConflictReport.none());
        when(bookingRepository.findById(100L)).thenReturn(Optional.of(pendingBooking));
    }

    private BookingRequest request(LocalDate start, LocalDate end) {
        return BookingRequest.builder().vehicleId(10L).startDate(start).endDate(end).build();
    }

    private void givenTransitionSucceeds(BookingStatus target) {
        when(bookingRepository.transitionStatus(eq(100L), eq(BookingStatus.PENDING), eq(target), any()))
                .thenAnswer(inv -> {
                    pendingBooking.setStatus(target);
                    return 1;
                });
    }

    private double approvalCount(String result) {
        return meterRegistry.counter("rental.approval.total", "result", result).count();
    }

    @Nested
    @DisplayName("Create Booking Tests")
    class CreateBookingTests {

        @Test
        @DisplayName("Creates a pending booking priced at days times rate")
        void createBooking_Valid_Pending() {
            BookingEntry result = bookingService.createBooking(customerActor, request(jan(1), jan(4)));

            assertThat(result.getId()).isEqualTo(200L);
            assertThat(result.getStatus()).isEqualTo("PENDING");
            assertThat(result.getUserId()).isEqualTo(2L);
            assertThat(result.getRentalDays()).isEqualTo(3);
            assertThat(result.getTotalFee()).isEqualByComparingTo("150.00");
            assertThat(result.getWarnings()).isEmpty();
            assertThat(meterRegistry.counter("rental.booking.created").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Extras are stored as charges and included in the fee")
        void createBooking_WithExtras_AddsToFee() {
            BookingRequest request = request(jan(1), jan(4));
            request.setExtras(List.of(ChargeRequest.builder().code(" GPS ").amount(new BigDecimal("15")).build()));

            BookingEntry result = bookingService.createBooking(customerActor, request);

            assertThat(result.getTotalFee()).isEqualByComparingTo("165.00");
            ArgumentCaptor<BookingCharge> captor = ArgumentCaptor.forClass(BookingCharge.class);
            verify(chargeRepository).save(captor.capture());
            assertThat(captor.getValue().getCode()).isEqualTo("GPS");
            assertThat(captor.getValue().getAmount()).isEqualByComparingTo("15.00");
        }

        @Test
        @DisplayName("Overlaps with approved records become warnings, not errors")
        void createBooking_Overlap_Warns() {
            when(availabilityService.findConflicts(eq(10L), any(DateRange.class), eq(200L)))
                    .thenReturn(new ConflictReport(List.of(100L), List.of(7L)));

            BookingEntry result = bookingService.createBooking(customerActor, request(jan(6), jan(9)));

            assertThat(result.getStatus()).isEqualTo("PENDING");
            assertThat(result.getWarnings()).containsExactly(
                    "Overlaps approved booking 100", "Overlaps maintenance window 7");
        }

        @Test
        @DisplayName("Zero-day range is rejected")
        void createBooking_ZeroDays_Throws() {
            assertThatThrownBy(() -> bookingService.createBooking(customerActor, request(jan(4), jan(4))))
                    .isInstanceOf(InvalidRangeException.class);
            verify(bookingRepository, never()).save(any());
        }

        @Test
        @DisplayName("Duration below the vehicle minimum is rejected")
        void createBooking_BelowMinimum_Throws() {
            vehicle.setMinRentDays(3);

            assertThatThrownBy(() -> bookingService.createBooking(customerActor, request(jan(1), jan(3))))
                    .isInstanceOf(InvalidRangeException.class);
        }

        @Test
        @DisplayName("Duration above the vehicle maximum is rejected")
        void createBooking_AboveMaximum_Throws() {
            vehicle.setMaxRentDays(2);

            assertThatThrownBy(() -> bookingService.createBooking(customerActor, request(jan(1), jan(4))))
                    .isInstanceOf(InvalidRangeException.class);
        }

        @Test
        @DisplayName("Off-market vehicle cannot be booked")
        void createBooking_OffMarket_Throws() {
            vehicle.setAvailableNow(false);

            assertThatThrownBy(() -> bookingService.createBooking(customerActor, request(jan(1), jan(4))))
                    .isInstanceOf(VehicleUnavailableException.class);
            verify(bookingRepository, never()).save(any());
        }

        @Test
        @DisplayName("Non-positive extra is rejected")
        void createBooking_ZeroExtra_Throws() {
            BookingRequest request = request(jan(1), jan(4));
            request.setExtras(List.of(ChargeRequest.builder().code("GPS").amount(BigDecimal.ZERO).build()));

            assertThatThrownBy(() -> bookingService.createBooking(customerActor, request))
                    .isInstanceOf(RentalValidationException.class);
        }

        @Test
        @DisplayName("Customer cannot book for somebody else")
        void createBooking_CustomerForOther_Forbidden() {
            BookingRequest request = request(jan(1), jan(4));
            request.setUserId(3L);

            assertThatThrownBy(() -> bookingService.createBooking(customerActor, request))
                    .isInstanceOf(AccessDeniedException.class);
        }

        @Test
        @DisplayName("Admin can book on behalf of a customer by email")
        void createBooking_AdminOnBehalf() {
            when(userService.findByEmailOrThrow("bob@example.com")).thenReturn(otherCustomer);
            BookingRequest request = request(jan(1), jan(4));
            request.setCustomerEmail("bob@example.com");

            BookingEntry result = bookingService.createBooking(admin, request);

            assertThat(result.getUserId()).isEqualTo(3L);
        }

        @Test
        @DisplayName("Unknown vehicle surfaces as not found")
        void createBooking_UnknownVehicle_Throws() {
            when(fleetService.findVehicleOrThrow(99L)).thenThrow(ResourceNotFoundException.vehicle(99L));
            BookingRequest request = request(jan(1), jan(4));
            request.setVehicleId(99L);

            assertThatThrownBy(() -> bookingService.createBooking(customerActor, request))
                    .isInstanceOf(ResourceNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("Approve Booking Tests")
    class ApproveBookingTests {

        @Test
        @DisplayName("Approves a pending booking with no conflicts")
        void approveBooking_NoConflicts_Approved() {
            givenTransitionSucceeds(BookingStatus.APPROVED);

            BookingEntry result = bookingService.approveBooking(admin, 100L);

            assertThat(result.getStatus()).isEqualTo("APPROVED");
            verify(fleetService).lockVehicle(10L);
            verify(availabilityService).findConflicts(eq(10L), eq(DateRange.of(jan(5), jan(10))), eq(100L));
            verify(cacheService).invalidate();
            verify(transactionManager).commit(any());
            assertThat(approvalCount("success")).isEqualTo(1.0);
            assertThat(meterRegistry.timer("rental.approval.duration").count()).isEqualTo(1L);
        }

        @Test
        @DisplayName("Conflict leaves the booking pending")
        void approveBooking_Conflict_StaysPending() {
            when(availabilityService.findConflicts(eq(10L), any(DateRange.class), eq(100L)))
                    .thenReturn(new ConflictReport(List.of(55L), List.of()));

            assertThatThrownBy(() -> bookingService.approveBooking(admin, 100L))
                    .isInstanceOfSatisfying(BookingConflictException.class,
                            ex -> assertThat(ex.getConflictingBookingIds()).containsExactly(55L));

            assertThat(pendingBooking.getStatus()).isEqualTo(BookingStatus.PENDING);
            verify(bookingRepository, never()).transitionStatus(any(), any(), any(), any());
            verify(transactionManager).rollback(any());
            verify(cacheService, never()).invalidate();
            assertThat(approvalCount("conflict")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Maintenance overlap blocks approval")
        void approveBooking_Maintenance_Conflict() {
            when(availabilityService.findConflicts(eq(10L), any(DateRange.class), eq(100L)))
                    .thenReturn(new ConflictReport(List.of(), List.of(7L)));

            assertThatThrownBy(() -> bookingService.approveBooking(admin, 100L))
                    .isInstanceOf(BookingConflictException.class);
        }

        @Test
        @DisplayName("Approving an already approved booking fails")
        void approveBooking_AlreadyApproved_InvalidState() {
            pendingBooking.setStatus(BookingStatus.APPROVED);

            assertThatThrownBy(() -> bookingService.approveBooking(admin, 100L))
                    .isInstanceOf(InvalidStateException.class);
            assertThat(approvalCount("invalid_state")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Losing the conditional update race fails with invalid state")
        void approveBooking_LostRace_InvalidState() {
            when(bookingRepository.transitionStatus(eq(100L), any(), any(), any())).thenReturn(0);

            assertThatThrownBy(() -> bookingService.approveBooking(admin, 100L))
                    .isInstanceOf(InvalidStateException.class);
        }

        @Test
        @DisplayName("Customers cannot approve")
        void approveBooking_Customer_Forbidden() {
            assertThatThrownBy(() -> bookingService.approveBooking(customerActor, 100L))
                    .isInstanceOf(AccessDeniedException.class);
            verify(transactionManager, never()).getTransaction(any());
        }

        @Test
        @DisplayName("Unknown booking surfaces as not found")
        void approveBooking_Unknown_NotFound() {
            when(bookingRepository.findById(999L)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> bookingService.approveBooking(admin, 999L))
                    .isInstanceOf(ResourceNotFoundException.class);
            assertThat(approvalCount("rejected")).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Reject Booking Tests")
    class RejectBookingTests {

        @Test
        @DisplayName("Rejects a pending booking")
        void rejectBooking_Pending_Rejected() {
            givenTransitionSucceeds(BookingStatus.REJECTED);

            BookingEntry result = bookingService.rejectBooking(admin, 100L, "No licence on file");

            assertThat(result.getStatus()).isEqualTo("REJECTED");
        }

        @Test
        @DisplayName("A rejected booking can no longer be approved")
        void rejectThenApprove_InvalidState() {
            givenTransitionSucceeds(BookingStatus.REJECTED);
            bookingService.rejectBooking(admin, 100L, null);

            assertThatThrownBy(() -> bookingService.approveBooking(admin, 100L))
                    .isInstanceOf(InvalidStateException.class);
        }

        @Test
        @DisplayName("An approved booking cannot be rejected")
        void rejectBooking_Approved_InvalidState() {
            pendingBooking.setStatus(BookingStatus.APPROVED);

            assertThatThrownBy(() -> bookingService.rejectBooking(admin, 100L, null))
                    .isInstanceOf(InvalidStateException.class);
        }
    }

    @Nested
    @DisplayName("Charge Tests")
    class ChargeTests {

        @Test
        @DisplayName("Adding a charge raises the total by its amount")
        void addCharge_Valid_RaisesTotal() {
            when(chargeRepository.sumAmountByBookingId(100L)).thenReturn(new BigDecimal("50.00"));
            when(bookingRepository.updateTotalFee(eq(100L), any(), any())).thenAnswer(inv -> {
                pendingBooking.setTotalFee(inv.getArgument(1));
                return 1;
            });

            BookingEntry result = bookingService.addCharge(admin, 100L,
                    ChargeRequest.builder().code("CLEANING").amount(new BigDecimal("50")).build());

            assertThat(result.getTotalFee()).isEqualByComparingTo("300.00");
            verify(chargeRepository).save(any(BookingCharge.class));
        }

        @Test
        @DisplayName("Charges cannot be added to rejected bookings")
        void addCharge_Rejected_InvalidState() {
            pendingBooking.setStatus(BookingStatus.REJECTED);

            assertThatThrownBy(() -> bookingService.addCharge(admin, 100L,
                    ChargeRequest.builder().code("CLEANING").amount(BigDecimal.TEN).build()))
                    .isInstanceOf(InvalidStateException.class);
            verify(chargeRepository, never()).save(any());
        }

        @Test
        @DisplayName("Negative charge is rejected")
        void addCharge_Negative_Throws() {
            assertThatThrownBy(() -> bookingService.addCharge(admin, 100L,
                    ChargeRequest.builder().code("REFUND").amount(new BigDecimal("-5")).build()))
                    .isInstanceOf(RentalValidationException.class);
        }

        @Test
        @DisplayName("Customers cannot add charges")
        void addCharge_Customer_Forbidden() {
            assertThatThrownBy(() -> bookingService.addCharge(customerActor, 100L,
                    ChargeRequest.builder().code("CLEANING").amount(BigDecimal.TEN).build()))
                    .isInstanceOf(AccessDeniedException.class);
        }

        @Test
        @DisplayName("Recalculation with no charges falls back to the base fee")
        void recalculateFee_NoCharges_BaseFee() {
            pendingBooking.setTotalFee(new BigDecimal("999.00"));
            when(chargeRepository.sumAmountByBookingId(100L)).thenReturn(null);

            bookingService.recalculateFee(admin, 100L);

            verify(bookingRepository).updateTotalFee(eq(100L), argThat(fee -> fee.compareTo(new BigDecimal("250.00")) == 0), any());
        }
    }

    @Nested
    @DisplayName("Query Tests")
    class QueryTests {

        @Test
        @DisplayName("Owner can read their booking")
        void getBooking_Owner() {
            assertThat(bookingService.getBooking(customerActor, 100L).getId()).isEqualTo(100L);
        }

        @Test
        @DisplayName("Other customers cannot read the booking")
        void getBooking_OtherCustomer_Forbidden() {
            assertThatThrownBy(() -> bookingService.getBooking(Actor.customer(3L), 100L))
                    .isInstanceOf(AccessDeniedException.class);
        }

        @Test
        @DisplayName("Customer listing of another user is forbidden")
        void listForUser_OtherCustomer_Forbidden() {
            assertThatThrownBy(() -> bookingService.listForUser(customerActor, 3L))
                    .isInstanceOf(AccessDeniedException.class);
        }

        @Test
        @DisplayName("Pending queue is admin-only")
        void listPending_Customer_Forbidden() {
            assertThatThrownBy(() -> bookingService.listPending(customerActor))
                    .isInstanceOf(AccessDeniedException.class);
        }

        @Test
        @DisplayName("Pending queue lists bookings oldest first")
        void listPending_Admin() {
            when(bookingRepository.findByStatusOldestFirst(BookingStatus.PENDING)).thenReturn(List.of(pendingBooking));

            assertThat(bookingService.listPending(admin)).extracting(BookingEntry::getId).containsExactly(100L);
        }
    }
}
