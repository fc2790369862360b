package com.hoteldesk.frontdesk.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateClientRequest(
        @NotBlank(message = "Name cannot be blank")
        @Size(max = 120, message = "Name must be at most 120 characters")
        String name,

        @NotBlank(message = "Phone cannot be blank")
        @Size(max = 40, message = "Phone must be at most 40 characters")
        String phone
) {
}
