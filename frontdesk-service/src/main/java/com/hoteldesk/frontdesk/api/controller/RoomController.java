package com.hoteldesk.frontdesk.api.controller;

import com.hoteldesk.common.dto.BaseResponse;
import com.hoteldesk.frontdesk.api.dto.CreateRoomRequest;
import com.hoteldesk.frontdesk.api.dto.RoomResponse;
import com.hoteldesk.frontdesk.api.dto.UpdateRoomRateRequest;
import com.hoteldesk.frontdesk.domain.service.RoomAvailabilityManager;
import com.hoteldesk.frontdesk.domain.service.RoomService;
import com.hoteldesk.frontdesk.security.AccessGate;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Room registration, rates and occupancy.
 */
@RestController
@RequestMapping("/api/v1/rooms")
@RequiredArgsConstructor
public class RoomController {

    private final RoomService roomService;
    private final RoomAvailabilityManager availabilityManager;
    private final AccessGate accessGate;

    @PostMapping
    public ResponseEntity<BaseResponse<RoomResponse>> addRoom(
            @Valid @RequestBody CreateRoomRequest request, HttpServletRequest httpRequest) {
        RoomResponse response = roomService.addRoom(accessGate.currentPrincipal(httpRequest), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(BaseResponse.success("Room added", response));
    }

    @GetMapping
    public ResponseEntity<BaseResponse<List<RoomResponse>>> listRooms(HttpServletRequest httpRequest) {
        return ResponseEntity.ok(BaseResponse.success(
                roomService.listRooms(accessGate.currentPrincipal(httpRequest))));
    }

    @GetMapping("/available")
    public ResponseEntity<BaseResponse<List<RoomResponse>>> listAvailableRooms(HttpServletRequest httpRequest) {
        return ResponseEntity.ok(BaseResponse.success(
                availabilityManager.listAvailableRooms(accessGate.currentPrincipal(httpRequest))));
    }

    @PutMapping("/{id}/rate")
    public ResponseEntity<BaseResponse<RoomResponse>> updateRate(
            @PathVariable Long id,
            @Valid @RequestBody UpdateRoomRateRequest request,
            HttpServletRequest httpRequest) {
        RoomResponse response = roomService.updateRoomRate(
                accessGate.currentPrincipal(httpRequest), id, request.rate());
        return ResponseEntity.ok(BaseResponse.success("Rate updated", response));
    }

    /**
     * Check-out: frees the room for new bookings.
     */
    @PostMapping("/{id}/release")
    public ResponseEntity<BaseResponse<RoomResponse>> releaseRoom(
            @PathVariable Long id, HttpServletRequest httpRequest) {
        RoomResponse response = availabilityManager.releaseRoom(accessGate.currentPrincipal(httpRequest), id);
        return ResponseEntity.ok(BaseResponse.success("Room released", response));
    }
}
