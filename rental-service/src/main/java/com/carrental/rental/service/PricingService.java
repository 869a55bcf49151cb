package com.carrental.rental.service;

import com.carrental.rental.constants.RentalConstants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;

/**
 * Booking fee arithmetic: {@code daily_rate * rental_days + sum(charges)}, kept at two
 * decimal places with half-up rounding.
 */
@Service
@Slf4j
public class PricingService {

    public BigDecimal baseFee(BigDecimal dailyRate, int rentalDays) {
        return scale(dailyRate.multiply(BigDecimal.valueOf(rentalDays)));
    }

    public BigDecimal totalFee(BigDecimal dailyRate, int rentalDays, BigDecimal chargesTotal) {
        BigDecimal extras = chargesTotal != null ? chargesTotal : BigDecimal.ZERO;
        BigDecimal total = scale(baseFee(dailyRate, rentalDays).add(extras));
        log.debug("Calculated fee: rate={}, days={}, extras={}, total={}", dailyRate, rentalDays, extras, total);
        return total;
    }

    public BigDecimal sum(Collection<BigDecimal> amounts) {
        BigDecimal total = BigDecimal.ZERO;
        for (BigDecimal amount : amounts) {
            total = total.add(amount);
        }
        return scale(total);
    }

    public BigDecimal scale(BigDecimal amount) {
        return amount.setScale(RentalConstants.FEE_SCALE, RoundingMode.HALF_UP);
    }
}
