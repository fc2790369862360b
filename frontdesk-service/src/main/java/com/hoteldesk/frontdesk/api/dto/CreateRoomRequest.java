package com.hoteldesk.frontdesk.api.dto;

import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

public record CreateRoomRequest(
        @NotBlank(message = "Room number cannot be blank")
        @Size(max = 20, message = "Room number must be at most 20 characters")
        String number,

        @NotBlank(message = "Room type cannot be blank")
        @Size(max = 50, message = "Room type must be at most 50 characters")
        String type,

        @NotNull(message = "Rate cannot be null")
        @Positive(message = "Rate must be positive")
        @Digits(integer = 8, fraction = 2, message = "Rate must have at most 2 decimals")
        BigDecimal rate
) {
}
