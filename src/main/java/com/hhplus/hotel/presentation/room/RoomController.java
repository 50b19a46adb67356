package com.hhplus.hotel.presentation.room;

import com.hhplus.hotel.application.room.RoomService;
import com.hhplus.hotel.presentation.room.request.CheckAvailabilityRequest;
import com.hhplus.hotel.presentation.room.response.AvailabilityResponse;
import com.hhplus.hotel.presentation.room.response.RoomListResponse;
import com.hhplus.hotel.presentation.room.response.RoomResponse;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * RoomController - Presentation 계층
 * 객실 조회 API
 */
@RestController
@RequestMapping("/rooms")
public class RoomController {

    private final RoomService roomService;

    public RoomController(RoomService roomService) {
        this.roomService = roomService;
    }

    /**
     * GET /rooms - 판매 중 객실 목록
     */
    @GetMapping
    public ResponseEntity<RoomListResponse> getRooms() {
        return ResponseEntity.ok(RoomListResponse.from(roomService.getAvailableRooms()));
    }

    /**
     * GET /rooms/{id} - 객실 상세
     */
    @GetMapping("/{id}")
    public ResponseEntity<RoomResponse> getRoom(@PathVariable("id") Long roomId) {
        return ResponseEntity.ok(RoomResponse.from(roomService.getRoom(roomId)));
    }

    /**
     * POST /rooms/check-availability - 기간 예약 가능 여부
     */
    @PostMapping("/check-availability")
    public ResponseEntity<AvailabilityResponse> checkAvailability(
            @Valid @RequestBody CheckAvailabilityRequest request) {
        return ResponseEntity.ok(AvailabilityResponse.from(roomService.checkAvailability(
                request.getRoomId(), request.getCheckInDate(), request.getCheckOutDate())));
    }
}
