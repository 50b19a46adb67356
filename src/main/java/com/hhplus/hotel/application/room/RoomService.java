package com.hhplus.hotel.application.room;

import com.hhplus.hotel.application.room.dto.AvailabilityResult;
import com.hhplus.hotel.common.exception.DomainException;
import com.hhplus.hotel.common.exception.ErrorCode;
import com.hhplus.hotel.domain.booking.RoomBookingRepository;
import com.hhplus.hotel.domain.common.vo.StayRange;
import com.hhplus.hotel.domain.room.Room;
import com.hhplus.hotel.domain.room.RoomNotFoundException;
import com.hhplus.hotel.domain.room.RoomRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;

/**
 * RoomService - 객실 조회 및 예약 가능 여부 Application 서비스
 */
@Service
@Transactional(readOnly = true)
public class RoomService {

    private final RoomRepository roomRepository;
    private final RoomBookingRepository roomBookingRepository;

    public RoomService(RoomRepository roomRepository, RoomBookingRepository roomBookingRepository) {
        this.roomRepository = roomRepository;
        this.roomBookingRepository = roomBookingRepository;
    }

    /**
     * 판매 중 객실 목록 (객실 번호 순)
     */
    public List<Room> getAvailableRooms() {
        return roomRepository.findAvailableOrderByRoomNumber();
    }

    /**
     * 객실 단건 조회 (판매 여부 무관)
     */
    public Room getRoom(Long roomId) {
        return roomRepository.findById(roomId)
                .orElseThrow(() -> new RoomNotFoundException(roomId));
    }

    /**
     * 기간 [checkIn, checkOut) 예약 가능 여부
     *
     * CONFIRMED/CHECKED_IN 예약 중 기간이 겹치는 건이 없으면 가능.
     * 조회 시점 기준의 참고값이며 체크아웃 시 다시 확인하지 않는다.
     *
     * @throws DomainException INVALID_STAY_RANGE (날짜 누락 또는 checkOut <= checkIn)
     * @throws RoomNotFoundException 객실 없음
     */
    public AvailabilityResult checkAvailability(Long roomId, LocalDate checkIn, LocalDate checkOut) {
        StayRange stayRange = StayRange.ofNullable(checkIn, checkOut)
                .filter(StayRange::isOrdered)
                .orElseThrow(() -> new DomainException(ErrorCode.INVALID_STAY_RANGE,
                        "체크아웃 날짜는 체크인 날짜보다 뒤여야 합니다"));

        Room room = getRoom(roomId);
        long conflicts = roomBookingRepository.countOverlapping(room.getRoomId(), stayRange);
        return new AvailabilityResult(room.getRoomId(), stayRange, conflicts);
    }
}
