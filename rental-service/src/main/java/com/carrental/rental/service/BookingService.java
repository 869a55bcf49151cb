package com.carrental.rental.service;

import com.carrental.rental.access.AccessPolicy;
import com.carrental.rental.access.Actor;
import com.carrental.rental.dto.BookingEntry;
import com.carrental.rental.dto.BookingRequest;
import com.carrental.rental.dto.ChargeEntry;
import com.carrental.rental.dto.ChargeRequest;
import com.carrental.rental.dto.ConflictReport;
import com.carrental.rental.dto.PageResponse;
import com.carrental.rental.enums.BookingStatus;
import com.carrental.rental.enums.RentalAction;
import com.carrental.rental.exception.BookingConflictException;
import com.carrental.rental.exception.InvalidStateException;
import com.carrental.rental.exception.RentalException;
import com.carrental.rental.exception.ResourceNotFoundException;
import com.carrental.rental.exception.VehicleUnavailableException;
import com.carrental.rental.mapper.BookingMapper;
import com.carrental.rental.model.Booking;
import com.carrental.rental.model.BookingCharge;
import com.carrental.rental.model.User;
import com.carrental.rental.model.Vehicle;
import com.carrental.rental.repository.BookingChargeRepository;
import com.carrental.rental.repository.BookingRepository;
import com.carrental.rental.util.DateRange;
import com.carrental.rental.validator.BookingValidator;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Booking ledger. Creation is lenient and only reports conflicts; approval is where
 * overlaps with approved bookings and maintenance are enforced.
 */
@Service
@Slf4j
public class BookingService {

    private final BookingRepository bookingRepository;
    private final BookingChargeRepository chargeRepository;
    private final FleetService fleetService;
    private final UserService userService;
    private final AvailabilityService availabilityService;
    private final AvailabilityCacheService cacheService;
    private final PricingService pricingService;
    private final BookingMapper bookingMapper;
    private final MeterRegistry meterRegistry;
    private final TransactionTemplate approvalTransaction;

    public BookingService(
            BookingRepository bookingRepository,
            BookingChargeRepository chargeRepository,
            FleetService fleetService,
            UserService userService,
            AvailabilityService availabilityService,
            AvailabilityCacheService cacheService,
            PricingService pricingService,
            BookingMapper bookingMapper,
            MeterRegistry meterRegistry,
            PlatformTransactionManager transactionManager) {
        this.bookingRepository = bookingRepository;
        this.chargeRepository = chargeRepository;
        this.fleetService = fleetService;
        this.userService = userService;
        this.availabilityService = availabilityService;
        this.cacheService = cacheService;
        this.pricingService = pricingService;
        this.bookingMapper = bookingMapper;
        this.meterRegistry = meterRegistry;
        this.approvalTransaction = new TransactionTemplate(transactionManager);
        this.approvalTransaction.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
    }

    // ========== Creation ==========

    /**
     * Records a pending booking. Overlaps with approved bookings or maintenance are returned
     * as warnings and do not block creation.
     */
    @Transactional
    public BookingEntry createBooking(Actor actor, BookingRequest request) {
        AccessPolicy.require(actor, RentalAction.CREATE_BOOKING);
        DateRange range = BookingValidator.validateRequest(request);

        User owner = resolveOwner(actor, request);
        Vehicle vehicle = fleetService.findVehicleOrThrow(request.getVehicleId());
        if (!Boolean.TRUE.equals(vehicle.getAvailableNow())) {
            log.warn("Booking refused, vehicle off market: vehicleId={}", vehicle.getId());
            throw new VehicleUnavailableException(vehicle.getId());
        }

        int rentalDays = range.durationDays();
        BookingValidator.validateRentalDays(vehicle, rentalDays);

        List<ChargeRequest> extras = request.getExtras() != null ? request.getExtras() : List.of();
        List<BigDecimal> extraAmounts = new ArrayList<>(extras.size());
        for (ChargeRequest extra : extras) {
            extraAmounts.add(pricingService.scale(extra.getAmount()));
        }

        Booking booking = Booking.builder()
                .user(owner)
                .vehicle(vehicle)
                .startDate(range.start())
                .endDate(range.end())
                .rentalDays(rentalDays)
                .dailyRate(vehicle.getDailyRate())
                .totalFee(pricingService.totalFee(vehicle.getDailyRate(), rentalDays, pricingService.sum(extraAmounts)))
                .status(BookingStatus.PENDING)
                .build();
        Booking saved = bookingRepository.save(booking);

        for (int i = 0; i < extras.size(); i++) {
            chargeRepository.save(BookingCharge.builder()
                    .booking(saved)
                    .code(extras.get(i).getCode().trim())
                    .amount(extraAmounts.get(i))
                    .build());
        }

        ConflictReport report = availabilityService.findConflicts(vehicle.getId(), range, saved.getId());
        if (!report.isEmpty()) {
            log.info("Booking {} recorded with soft conflicts: bookings={}, maintenance={}",
                    saved.getId(), report.bookingIds(), report.maintenanceIds());
        }

        meterRegistry.counter("rental.booking.created").increment();
        log.info("Booking created: id={}, user={}, vehicle={}, range={}, fee={}",
                saved.getId(), owner.getId(), vehicle.getId(), range, saved.getTotalFee());
        return bookingMapper.toEntry(saved, report.toWarnings());
    }

    // ========== Status Transitions ==========

    /**
     * Approves a pending booking. Runs in its own READ_COMMITTED transaction that holds the
     * vehicle row lock from the conflict re-check until the status flip commits, so of two
     * overlapping bookings approved concurrently only the first wins.
     */
    public BookingEntry approveBooking(Actor actor, Long bookingId) {
        AccessPolicy.require(actor, RentalAction.APPROVE_BOOKING);
        BookingValidator.validateBookingId(bookingId);

        Timer.Sample sample = Timer.start(meterRegistry);
        log.info("Approving booking: id={}, by={}", bookingId, actor.userId());

        try {
            BookingEntry approved = approvalTransaction.execute(status -> doApprove(bookingId));
            meterRegistry.counter("rental.approval.total", "result", "success").increment();
            log.info("Booking approved: id={}", bookingId);
            return approved;
        } catch (BookingConflictException e) {
            meterRegistry.counter("rental.approval.total", "result", "conflict").increment();
            log.warn("Approval rejected by conflict: {}", e.getMessage());
            throw e;
        } catch (InvalidStateException e) {
            meterRegistry.counter("rental.approval.total", "result", "invalid_state").increment();
            throw e;
        } catch (RentalException e) {
            meterRegistry.counter("rental.approval.total", "result", "rejected").increment();
            throw e;
        } catch (RuntimeException e) {
            meterRegistry.counter("rental.approval.total", "result", "error").increment();
            log.error("Error approving booking: id={}, error={}", bookingId, e.getMessage(), e);
            throw e;
        } finally {
            sample.stop(Timer.builder("rental.approval.duration").register(meterRegistry));
        }
    }

    private BookingEntry doApprove(Long bookingId) {
        Booking booking = findBookingOrThrow(bookingId);
        if (!booking.isPending()) {
            throw InvalidStateException.notPending(bookingId, booking.getStatus(), "approved");
        }

        Long vehicleId = booking.getVehicle().getId();
        fleetService.lockVehicle(vehicleId);

        ConflictReport report = availabilityService.findConflicts(vehicleId, booking.range(), bookingId);
        if (!report.isEmpty()) {
            throw new BookingConflictException(bookingId, report.bookingIds(), report.maintenanceIds());
        }

        int updated = bookingRepository.transitionStatus(
                bookingId, BookingStatus.PENDING, BookingStatus.APPROVED, LocalDateTime.now());
        if (updated == 0) {
            throw new InvalidStateException("Booking " + bookingId + " was decided by another request");
        }

        cacheService.invalidate();
        return bookingMapper.toEntry(findBookingOrThrow(bookingId));
    }

    @Transactional
    public BookingEntry rejectBooking(Actor actor, Long bookingId, String reason) {
        AccessPolicy.require(actor, RentalAction.REJECT_BOOKING);
        BookingValidator.validateBookingId(bookingId);

        Booking booking = findBookingOrThrow(bookingId);
        if (!booking.isPending()) {
            throw InvalidStateException.notPending(bookingId, booking.getStatus(), "rejected");
        }

        int updated = bookingRepository.transitionStatus(
                bookingId, BookingStatus.PENDING, BookingStatus.REJECTED, LocalDateTime.now());
        if (updated == 0) {
            throw new InvalidStateException("Booking " + bookingId + " was decided by another request");
        }

        log.info("Booking rejected: id={}, by={}, reason={}", bookingId, actor.userId(),
                StringUtils.hasText(reason) ? reason : "(none)");
        return bookingMapper.toEntry(findBookingOrThrow(bookingId));
    }

    // ========== Charges & Fees ==========

    /**
     * Appends a charge line and refreshes the cached total. Charges are never edited or removed.
     */
    @Transactional
    public BookingEntry addCharge(Actor actor, Long bookingId, ChargeRequest request) {
        AccessPolicy.require(actor, RentalAction.ADD_CHARGE);
        BookingValidator.validateBookingId(bookingId);
        BookingValidator.validateCharge(request != null ? request.getCode() : null,
                request != null ? request.getAmount() : null);

        Booking booking = findBookingOrThrow(bookingId);
        if (booking.getStatus() == BookingStatus.REJECTED) {
            throw new InvalidStateException("Charges cannot be added to rejected booking " + bookingId);
        }

        chargeRepository.save(BookingCharge.builder()
                .booking(booking)
                .code(request.getCode().trim())
                .amount(pricingService.scale(request.getAmount()))
                .build());

        BookingEntry updated = refreshTotalFee(booking);
        log.info("Charge added: bookingId={}, code={}, amount={}, total={}",
                bookingId, request.getCode(), request.getAmount(), updated.getTotalFee());
        return updated;
    }

    @Transactional
    public BookingEntry recalculateFee(Actor actor, Long bookingId) {
        AccessPolicy.require(actor, RentalAction.ADD_CHARGE);
        BookingValidator.validateBookingId(bookingId);

        BookingEntry updated = refreshTotalFee(findBookingOrThrow(bookingId));
        log.info("Fee recalculated: bookingId={}, total={}", bookingId, updated.getTotalFee());
        return updated;
    }

    @Transactional(readOnly = true)
    public List<ChargeEntry> getCharges(Actor actor, Long bookingId) {
        Booking booking = findBookingOrThrow(bookingId);
        AccessPolicy.requireOwnerOr(actor, booking.getUser().getId(),
                RentalAction.VIEW_OWN_BOOKINGS, RentalAction.VIEW_ALL_BOOKINGS);
        return bookingMapper.toChargeEntryList(chargeRepository.findByBookingId(bookingId));
    }

    // ========== Query Operations ==========

    @Transactional(readOnly = true)
    public BookingEntry getBooking(Actor actor, Long bookingId) {
        BookingValidator.validateBookingId(bookingId);
        Booking booking = findBookingOrThrow(bookingId);
        AccessPolicy.requireOwnerOr(actor, booking.getUser().getId(),
                RentalAction.VIEW_OWN_BOOKINGS, RentalAction.VIEW_ALL_BOOKINGS);
        return bookingMapper.toEntry(booking);
    }

    /**
     * Bookings of one user, newest first.
     */
    @Transactional(readOnly = true)
    public List<BookingEntry> listForUser(Actor actor, Long userId) {
        AccessPolicy.requireOwnerOr(actor, userId, RentalAction.VIEW_OWN_BOOKINGS, RentalAction.VIEW_ALL_BOOKINGS);
        userService.findUserOrThrow(userId);
        return bookingMapper.toEntryList(bookingRepository.findByUserIdNewestFirst(userId));
    }

    /**
     * The approval queue, oldest first.
     */
    @Transactional(readOnly = true)
    public List<BookingEntry> listPending(Actor actor) {
        AccessPolicy.require(actor, RentalAction.VIEW_ALL_BOOKINGS);
        return bookingMapper.toEntryList(bookingRepository.findByStatusOldestFirst(BookingStatus.PENDING));
    }

    @Transactional(readOnly = true)
    public PageResponse<BookingEntry> listAll(Actor actor, BookingStatus status, Pageable pageable) {
        AccessPolicy.require(actor, RentalAction.VIEW_ALL_BOOKINGS);
        Page<Booking> page = status != null
                ? bookingRepository.findByStatus(status, pageable)
                : bookingRepository.findAll(pageable);
        return PageResponse.of(page.map(bookingMapper::toEntry));
    }

    public Booking findBookingOrThrow(Long bookingId) {
        return bookingRepository.findById(bookingId)
                .orElseThrow(() -> ResourceNotFoundException.booking(bookingId));
    }

    // ========== Private Helpers ==========

    private User resolveOwner(Actor actor, BookingRequest request) {
        User owner;
        if (request.getUserId() != null) {
            owner = userService.findUserOrThrow(request.getUserId());
        } else if (StringUtils.hasText(request.getCustomerEmail())) {
            owner = userService.findByEmailOrThrow(request.getCustomerEmail());
        } else {
            return userService.findUserOrThrow(actor.userId());
        }

        if (!actor.isSelf(owner.getId())) {
            AccessPolicy.require(actor, RentalAction.CREATE_BOOKING_ON_BEHALF);
            log.info("Booking on behalf: admin={}, customer={}", actor.userId(), owner.getId());
        }
        return owner;
    }

    private BookingEntry refreshTotalFee(Booking booking) {
        Long bookingId = booking.getId();
        BigDecimal charges = chargeRepository.sumAmountByBookingId(bookingId);
        BigDecimal total = pricingService.totalFee(booking.getDailyRate(), booking.getRentalDays(), charges);
        bookingRepository.updateTotalFee(bookingId, total, LocalDateTime.now());
        return bookingMapper.toEntry(findBookingOrThrow(bookingId));
    }
}
