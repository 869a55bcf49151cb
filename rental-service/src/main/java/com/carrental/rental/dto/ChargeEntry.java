package com.carrental.rental.dto;

import lombok.*;
import lombok.experimental.FieldDefaults;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class ChargeEntry {

    Long id;
    Long bookingId;
    String code;
    BigDecimal amount;
}
