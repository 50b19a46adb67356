package com.hhplus.hotel.application.room.dto;

import com.hhplus.hotel.domain.common.vo.StayRange;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 객실 예약 가능 여부 조회 결과
 */
@Getter
@AllArgsConstructor
public class AvailabilityResult {
    private final Long roomId;
    private final StayRange stayRange;
    private final long conflictingBookings;

    public boolean isAvailable() {
        return conflictingBookings == 0;
    }
}
