package com.hoteldesk.frontdesk.domain.service;

import com.hoteldesk.common.exception.ResourceNotFoundException;
import com.hoteldesk.common.exception.ValidationException;
import com.hoteldesk.frontdesk.api.dto.CreateRoomRequest;
import com.hoteldesk.frontdesk.api.dto.RoomResponse;
import com.hoteldesk.frontdesk.domain.model.Room;
import com.hoteldesk.frontdesk.domain.model.User;
import com.hoteldesk.frontdesk.domain.repository.RoomRepository;
import com.hoteldesk.frontdesk.exception.DuplicateKeyException;
import com.hoteldesk.frontdesk.security.DeskPrincipal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.hibernate.exception.ConstraintViolationException;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Room registration and rate maintenance. Status is not editable here; see {@link RoomAvailabilityManager}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoomService {

    private final RoomRepository roomRepository;

    /**
     * Registers a room as AVAILABLE.
     *
     * @throws DuplicateKeyException if the room number is already used
     * @throws ValidationException if the number or type is missing
     */
    @Transactional
    public RoomResponse addRoom(DeskPrincipal principal, CreateRoomRequest request) {
        DeskPrincipal.require(principal);
        String number = RequestFields.requireText(request.number(), "Room number");
        String type = RequestFields.requireText(request.type(), "Room type");
        BigDecimal rate = normalizeRate(request.rate());

        if (roomRepository.existsByNumber(number)) {
            throw new DuplicateKeyException("Room", number);
        }

        Room room;
        try {
            // The unique constraint catches a concurrent insert the existence check missed
            room = roomRepository.saveAndFlush(Room.builder()
                    .number(number)
                    .type(type)
                    .rate(rate)
                    .status(Room.RoomStatus.AVAILABLE)
                    .build());
        } catch (DataIntegrityViolationException e) {
            if (!violates(e, Room.NUMBER_CONSTRAINT)) {
                throw e;
            }
            throw new DuplicateKeyException("Room", number, e);
        }
        log.info("Room {} ({}) added at rate {} by {}", room.getNumber(), room.getType(), rate, principal.username());
        return RoomResponse.from(room);
    }

    @Transactional(readOnly = true)
    public List<RoomResponse> listRooms(DeskPrincipal principal) {
        DeskPrincipal.require(principal);
        return roomRepository.findAllByOrderByIdAsc().stream()
                .map(RoomResponse::from)
                .collect(Collectors.toList());
    }

    /**
     * Changes the nightly rate for future bookings. Totals of existing bookings are stored
     * values and do not move.
     */
    @Transactional
    public RoomResponse updateRoomRate(DeskPrincipal principal, Long roomId, BigDecimal newRate) {
        DeskPrincipal.require(principal).requireRole(User.Role.ADMIN);
        BigDecimal rate = normalizeRate(newRate);
        Room room = roomRepository.findById(roomId)
                .orElseThrow(() -> new ResourceNotFoundException("Room", roomId));
        BigDecimal previous = room.getRate();
        room.setRate(rate);
        Room saved = roomRepository.save(room);
        log.info("Room {} rate changed from {} to {} by {}", saved.getNumber(), previous, rate, principal.username());
        return RoomResponse.from(saved);
    }

    private static boolean violates(DataIntegrityViolationException e, String constraint) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof ConstraintViolationException violation
                    && violation.getConstraintName() != null
                    && violation.getConstraintName().toLowerCase(Locale.ROOT).contains(constraint)) {
                return true;
            }
        }
        // H2 and PostgreSQL both name the violated index in the driver message
        String detail = NestedExceptionUtils.getMostSpecificCause(e).getMessage();
        return detail != null && detail.toLowerCase(Locale.ROOT).contains(constraint);
    }

    private BigDecimal normalizeRate(BigDecimal rate) {
        if (rate == null || rate.signum() <= 0) {
            throw new ValidationException("Nightly rate must be a positive amount");
        }
        return rate.setScale(2, RoundingMode.HALF_UP);
    }
}
