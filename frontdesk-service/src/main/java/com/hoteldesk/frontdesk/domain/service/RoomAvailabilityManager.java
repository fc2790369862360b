package com.hoteldesk.frontdesk.domain.service;

import com.hoteldesk.common.exception.ResourceNotFoundException;
import com.hoteldesk.frontdesk.api.dto.RoomResponse;
import com.hoteldesk.frontdesk.domain.model.Room;
import com.hoteldesk.frontdesk.domain.repository.RoomRepository;
import com.hoteldesk.frontdesk.exception.InvalidStateTransitionException;
import com.hoteldesk.frontdesk.security.DeskPrincipal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Owns room status transitions.
 *
 * Flow for both transitions:
 * 1. Acquire database-level lock on the room row (SELECT FOR UPDATE)
 * 2. Check the current status
 * 3. Flip the status and flush (the @Version column rejects a stale write)
 * 4. Commit releases the lock (the caller's transaction when one is active)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RoomAvailabilityManager {

    private final RoomRepository roomRepository;

    /**
     * AVAILABLE -> OCCUPIED. Joins the caller's transaction so the booking insert and the
     * status flip commit together.
     *
     * @throws InvalidStateTransitionException if the room is already occupied
     */
    @Transactional
    public Room markOccupied(Long roomId) {
        Room room = lockRoom(roomId);
        room.occupy();
        Room saved = flush(room, Room.RoomStatus.OCCUPIED);
        log.info("Room {} marked OCCUPIED", saved.getNumber());
        return saved;
    }

    /**
     * OCCUPIED -> AVAILABLE, ending the current stay. Bookings are left untouched.
     *
     * @throws InvalidStateTransitionException if the room is already available
     */
    @Transactional
    public RoomResponse releaseRoom(DeskPrincipal principal, Long roomId) {
        DeskPrincipal.require(principal);
        Room room = lockRoom(roomId);
        room.release();
        Room saved = flush(room, Room.RoomStatus.AVAILABLE);
        log.info("Room {} released by {}", saved.getNumber(), principal.username());
        return RoomResponse.from(saved);
    }

    @Transactional(readOnly = true)
    public List<RoomResponse> listAvailableRooms(DeskPrincipal principal) {
        DeskPrincipal.require(principal);
        return roomRepository.findByStatusOrderByNumberAsc(Room.RoomStatus.AVAILABLE).stream()
                .map(RoomResponse::from)
                .collect(Collectors.toList());
    }

    private Room lockRoom(Long roomId) {
        return roomRepository.findByIdForUpdate(roomId)
                .orElseThrow(() -> new ResourceNotFoundException("Room", roomId));
    }

    private Room flush(Room room, Room.RoomStatus target) {
        try {
            return roomRepository.saveAndFlush(room);
        } catch (OptimisticLockingFailureException e) {
            log.warn("Concurrent status change detected on room {}", room.getNumber());
            throw new InvalidStateTransitionException(room.getNumber(), target, e);
        }
    }
}
