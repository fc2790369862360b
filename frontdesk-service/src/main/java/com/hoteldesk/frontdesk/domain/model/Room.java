package com.hoteldesk.frontdesk.domain.model;

import com.hoteldesk.frontdesk.exception.InvalidStateTransitionException;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Room entity. The room number is the business key; status is maintained by the
 * availability manager and is never taken from user input.
 * Uses optimistic locking with @Version so a stale status write surfaces as a conflict.
 */
@Entity
@Table(name = "rooms",
        uniqueConstraints = @UniqueConstraint(name = Room.NUMBER_CONSTRAINT, columnNames = "number"),
        indexes = @Index(name = "idx_room_status", columnList = "status"))
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Room {
    public static final String NUMBER_CONSTRAINT = "uk_room_number";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "number", nullable = false, length = 20)
    private String number;

    @Column(name = "type", nullable = false, length = 50)
    private String type;

    @Column(name = "rate", nullable = false, precision = 10, scale = 2)
    private BigDecimal rate;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private RoomStatus status;

    @Version
    @Column(name = "version")
    private Long version;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
        if (status == null) {
            status = RoomStatus.AVAILABLE;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public boolean isAvailable() {
        return status == RoomStatus.AVAILABLE;
    }

    /**
     * AVAILABLE -> OCCUPIED. An occupied room cannot be occupied again.
     */
    public void occupy() {
        if (status != RoomStatus.AVAILABLE) {
            throw new InvalidStateTransitionException(number, status, RoomStatus.OCCUPIED);
        }
        status = RoomStatus.OCCUPIED;
    }

    /**
     * OCCUPIED -> AVAILABLE.
     */
    public void release() {
        if (status != RoomStatus.OCCUPIED) {
            throw new InvalidStateTransitionException(number, status, RoomStatus.AVAILABLE);
        }
        status = RoomStatus.AVAILABLE;
    }

    public enum RoomStatus {
        AVAILABLE,
        OCCUPIED
    }
}
