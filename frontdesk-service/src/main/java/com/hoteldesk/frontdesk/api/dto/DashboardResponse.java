package com.hoteldesk.frontdesk.api.dto;

import java.math.BigDecimal;

public record DashboardResponse(
        long totalRooms,
        long occupiedRooms,
        long availableRooms,
        BigDecimal revenue
) {
}
