package com.hoteldesk.frontdesk.domain.repository;

import com.hoteldesk.frontdesk.domain.model.Booking;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

public interface BookingRepository extends JpaRepository<Booking, Long> {

    /** Booking history joined with client and room, in insertion order. */
    @Query("SELECT b FROM Booking b JOIN FETCH b.client JOIN FETCH b.room ORDER BY b.id")
    List<Booking> findAllWithClientAndRoom();

    @Query("SELECT b FROM Booking b JOIN FETCH b.client JOIN FETCH b.room WHERE b.id = :id")
    Optional<Booking> findByIdWithClientAndRoom(@Param("id") Long id);

    boolean existsByRoomId(Long roomId);

    /** Null when there are no bookings. */
    @Query("SELECT SUM(b.totalPrice) FROM Booking b")
    BigDecimal sumTotalPrice();
}
