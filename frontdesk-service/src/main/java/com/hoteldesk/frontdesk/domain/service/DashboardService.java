package com.hoteldesk.frontdesk.domain.service;

import com.hoteldesk.frontdesk.api.dto.DashboardResponse;
import com.hoteldesk.frontdesk.domain.model.Room;
import com.hoteldesk.frontdesk.domain.repository.BookingRepository;
import com.hoteldesk.frontdesk.domain.repository.RoomRepository;
import com.hoteldesk.frontdesk.security.DeskPrincipal;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Occupancy and revenue figures for the desk overview.
 */
@Service
@RequiredArgsConstructor
public class DashboardService {

    private final RoomRepository roomRepository;
    private final BookingRepository bookingRepository;

    @Transactional(readOnly = true)
    public DashboardResponse summary(DeskPrincipal principal) {
        DeskPrincipal.require(principal);
        long totalRooms = roomRepository.count();
        long occupiedRooms = roomRepository.countByStatus(Room.RoomStatus.OCCUPIED);
        BigDecimal revenue = Optional.ofNullable(bookingRepository.sumTotalPrice()).orElse(BigDecimal.ZERO);
        return new DashboardResponse(totalRooms, occupiedRooms, totalRooms - occupiedRooms, revenue);
    }
}
