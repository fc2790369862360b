package com.hoteldesk.frontdesk.api.dto;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;

public record UpdateRoomRateRequest(
        @NotNull(message = "Rate cannot be null")
        @Positive(message = "Rate must be positive")
        @Digits(integer = 8, fraction = 2, message = "Rate must have at most 2 decimals")
        BigDecimal rate
) {
}
