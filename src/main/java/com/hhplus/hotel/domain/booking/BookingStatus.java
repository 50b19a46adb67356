package com.hhplus.hotel.domain.booking;

import lombok.Getter;

import java.util.EnumSet;
import java.util.Set;

/**
 * BookingStatus - 객실 예약 상태
 *
 * CONFIRMED, CHECKED_IN 상태의 예약만 기간 점유로 간주한다.
 */
@Getter
public enum BookingStatus {
    CONFIRMED("예약 확정"),
    CHECKED_IN("체크인"),
    CHECKED_OUT("체크아웃"),
    CANCELLED("예약 취소");

    /** 예약 가능 여부 계산 시 점유로 보는 상태 */
    public static final Set<BookingStatus> OCCUPYING = EnumSet.of(CONFIRMED, CHECKED_IN);

    private final String displayName;

    BookingStatus(String displayName) {
        this.displayName = displayName;
    }
}
