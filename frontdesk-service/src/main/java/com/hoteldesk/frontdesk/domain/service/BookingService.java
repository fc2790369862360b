package com.hoteldesk.frontdesk.domain.service;

import com.hoteldesk.common.exception.ResourceNotFoundException;
import com.hoteldesk.frontdesk.api.dto.BookingResponse;
import com.hoteldesk.frontdesk.api.dto.CreateBookingRequest;
import com.hoteldesk.frontdesk.domain.model.Booking;
import com.hoteldesk.frontdesk.domain.model.Client;
import com.hoteldesk.frontdesk.domain.model.Room;
import com.hoteldesk.frontdesk.domain.repository.BookingRepository;
import com.hoteldesk.frontdesk.domain.repository.ClientRepository;
import com.hoteldesk.frontdesk.domain.repository.RoomRepository;
import com.hoteldesk.frontdesk.exception.BookingNotFoundException;
import com.hoteldesk.frontdesk.exception.InvalidStateTransitionException;
import com.hoteldesk.frontdesk.exception.RoomUnavailableException;
import com.hoteldesk.frontdesk.security.DeskPrincipal;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Booking engine: validates a reservation against current room state, prices the stay
 * and records the booking together with the room status flip.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BookingService {

    private final BookingRepository bookingRepository;
    private final ClientRepository clientRepository;
    private final RoomRepository roomRepository;
    private final RoomAvailabilityManager availabilityManager;

    /**
     * Creates a booking. The room row stays locked from the availability check until commit,
     * so two requests for the same room cannot both see it available.
     *
     * @throws com.hoteldesk.frontdesk.exception.InvalidDateRangeException if check-out is not after check-in
     * @throws ResourceNotFoundException if the client or room does not exist
     * @throws RoomUnavailableException if the room is occupied
     * @throws com.hoteldesk.frontdesk.exception.TotalOutOfRangeException if the stay prices above the storable total
     */
    @Transactional
    public BookingResponse createBooking(DeskPrincipal principal, CreateBookingRequest request) {
        DeskPrincipal.require(principal);
        log.info("Creating booking for client ID: {}, room ID: {}, {} -> {}",
                request.clientId(), request.roomId(), request.checkInDate(), request.checkOutDate());

        StayPricing.nights(request.checkInDate(), request.checkOutDate());

        Client client = clientRepository.findById(request.clientId())
                .orElseThrow(() -> new ResourceNotFoundException("Client", request.clientId()));
        Room room = lockRoom(request.roomId());
        if (!room.isAvailable()) {
            throw new RoomUnavailableException(room.getNumber());
        }

        // Rate is read once here and baked into the stored total
        BigDecimal totalPrice = StayPricing.totalPrice(room.getRate(), request.checkInDate(), request.checkOutDate());

        try {
            room = availabilityManager.markOccupied(room.getId());
        } catch (InvalidStateTransitionException e) {
            throw new RoomUnavailableException(room.getNumber(), e);
        }

        Booking booking = bookingRepository.save(Booking.builder()
                .client(client)
                .room(room)
                .checkInDate(request.checkInDate())
                .checkOutDate(request.checkOutDate())
                .totalPrice(totalPrice)
                .createdBy(principal.username())
                .build());

        log.info("Booking {} created by {}: room {} for {}, total {}",
                booking.getId(), principal.username(), room.getNumber(), client.getName(), totalPrice);
        return BookingResponse.from(booking);
    }

    @Transactional(readOnly = true)
    public BookingResponse getBooking(DeskPrincipal principal, Long bookingId) {
        DeskPrincipal.require(principal);
        return bookingRepository.findByIdWithClientAndRoom(bookingId)
                .map(BookingResponse::from)
                .orElseThrow(() -> new BookingNotFoundException(bookingId));
    }

    /**
     * Booking history in insertion order.
     */
    @Transactional(readOnly = true)
    public List<BookingResponse> listBookings(DeskPrincipal principal) {
        DeskPrincipal.require(principal);
        return bookingRepository.findAllWithClientAndRoom().stream()
                .map(BookingResponse::from)
                .collect(Collectors.toList());
    }

    private Room lockRoom(Long roomId) {
        try {
            return roomRepository.findByIdForUpdate(roomId)
                    .orElseThrow(() -> new ResourceNotFoundException("Room", roomId));
        } catch (PessimisticLockingFailureException e) {
            log.warn("Timed out waiting for lock on room ID: {}", roomId);
            throw new RoomUnavailableException(String.valueOf(roomId), e);
        }
    }
}
