package com.carrental.rental.dto;

import com.carrental.rental.constants.ValidationMessages;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class ChargeRequest {

    @NotBlank(message = ValidationMessages.CHARGE_CODE_REQUIRED)
    String code;

    @NotNull(message = ValidationMessages.CHARGE_AMOUNT_REQUIRED)
    @DecimalMin(value = "0.00", inclusive = false, message = ValidationMessages.CHARGE_AMOUNT_POSITIVE)
    BigDecimal amount;
}
