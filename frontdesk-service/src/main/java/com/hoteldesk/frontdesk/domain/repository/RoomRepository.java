package com.hoteldesk.frontdesk.domain.repository;

import com.hoteldesk.frontdesk.domain.model.Room;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface RoomRepository extends JpaRepository<Room, Long> {

    /**
     * Find a room with pessimistic lock (SELECT FOR UPDATE).
     * Concurrent status changes of the same room queue up behind the lock holder's transaction.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM Room r WHERE r.id = :id")
    Optional<Room> findByIdForUpdate(@Param("id") Long id);

    boolean existsByNumber(String number);

    List<Room> findAllByOrderByIdAsc();

    List<Room> findByStatusOrderByNumberAsc(Room.RoomStatus status);

    long countByStatus(Room.RoomStatus status);
}
