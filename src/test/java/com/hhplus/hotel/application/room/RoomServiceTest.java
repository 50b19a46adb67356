package com.hhplus.hotel.application.room;

import com.hhplus.hotel.application.room.dto.AvailabilityResult;
import com.hhplus.hotel.common.exception.DomainException;
import com.hhplus.hotel.common.exception.ErrorCode;
import com.hhplus.hotel.domain.booking.RoomBookingRepository;
import com.hhplus.hotel.domain.common.vo.StayRange;
import com.hhplus.hotel.domain.room.Room;
import com.hhplus.hotel.domain.room.RoomNotFoundException;
import com.hhplus.hotel.domain.room.RoomRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("RoomService 단위 테스트")
class RoomServiceTest {

    private static final Long ROOM_ID = 3L;
    private static final LocalDate CHECK_IN = LocalDate.of(2025, 6, 1);
    private static final LocalDate CHECK_OUT = LocalDate.of(2025, 6, 4);

    @Mock
    private RoomRepository roomRepository;

    @Mock
    private RoomBookingRepository roomBookingRepository;

    private RoomService roomService;

    @BeforeEach
    void setup() {
        roomService = new RoomService(roomRepository, roomBookingRepository);
    }

    @Test
    @DisplayName("예약 가능 - 겹치는 예약 없음")
    void testCheckAvailability_Available() {
        when(roomRepository.findById(ROOM_ID)).thenReturn(Optional.of(Room.builder().roomId(ROOM_ID).build()));
        when(roomBookingRepository.countOverlapping(ROOM_ID, StayRange.of(CHECK_IN, CHECK_OUT))).thenReturn(0L);

        AvailabilityResult result = roomService.checkAvailability(ROOM_ID, CHECK_IN, CHECK_OUT);

        assertTrue(result.isAvailable());
        assertEquals(CHECK_IN, result.getStayRange().getCheckIn());
    }

    @Test
    @DisplayName("예약 불가 - 겹치는 예약 존재")
    void testCheckAvailability_Conflict() {
        when(roomRepository.findById(ROOM_ID)).thenReturn(Optional.of(Room.builder().roomId(ROOM_ID).build()));
        when(roomBookingRepository.countOverlapping(ROOM_ID, StayRange.of(CHECK_IN, CHECK_OUT))).thenReturn(2L);

        AvailabilityResult result = roomService.checkAvailability(ROOM_ID, CHECK_IN, CHECK_OUT);

        assertFalse(result.isAvailable());
        assertEquals(2L, result.getConflictingBookings());
    }

    @Test
    @DisplayName("조회 실패 - 체크아웃이 체크인과 같으면 INVALID_STAY_RANGE")
    void testCheckAvailability_SameDay() {
        DomainException exception = assertThrows(DomainException.class,
                () -> roomService.checkAvailability(ROOM_ID, CHECK_IN, CHECK_IN));

        assertEquals(ErrorCode.INVALID_STAY_RANGE, exception.getErrorCode());
        verifyNoInteractions(roomRepository, roomBookingRepository);
    }

    @Test
    @DisplayName("조회 실패 - 날짜 누락")
    void testCheckAvailability_MissingDate() {
        assertThrows(DomainException.class, () -> roomService.checkAvailability(ROOM_ID, null, CHECK_OUT));
    }

    @Test
    @DisplayName("조회 실패 - 객실 없음")
    void testCheckAvailability_RoomNotFound() {
        when(roomRepository.findById(ROOM_ID)).thenReturn(Optional.empty());

        assertThrows(RoomNotFoundException.class,
                () -> roomService.checkAvailability(ROOM_ID, CHECK_IN, CHECK_OUT));
    }
}
