package com.carrental.rental.dto;

import lombok.*;
import lombok.experimental.FieldDefaults;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class VehicleFilterCriteria {

    String make;
    String model;
    Integer yearMin;
    Integer yearMax;
    Boolean available;
    BigDecimal maxDailyRate;

    public static VehicleFilterCriteria none() {
        return new VehicleFilterCriteria();
    }

    /**
     * Stable textual form used in availability cache keys.
     */
    public String cacheKey() {
        return String.join("|",
                normalize(make),
                normalize(model),
                String.valueOf(yearMin),
                String.valueOf(yearMax),
                String.valueOf(available),
                maxDailyRate == null ? "null" : maxDailyRate.stripTrailingZeros().toPlainString());
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase();
    }
}
