package com.hhplus.hotel.domain.common.vo;

import java.io.Serializable;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.Optional;

/**
 * StayRange Value Object
 *
 * 객실 숙박 기간 [체크인, 체크아웃)을 나타내는 반열린 구간 값 객체입니다.
 *
 * 사용처:
 * - CartItem / OrderItem (객실 항목의 숙박 기간)
 * - RoomBooking (예약 기간)
 * - 객실 예약 가능 여부 조회
 *
 * 특징:
 * - Immutable: 생성 후 변경 불가능
 * - 장바구니에는 체크아웃이 체크인보다 빠르거나 같은 기간도 들어올 수 있으므로
 *   생성 시 순서를 강제하지 않는다. 숙박일 수는 최소 1박으로 보정된다.
 * - 예약 가능 여부 조회처럼 순서가 필요한 곳은 {@link #isOrdered()}로 검증한다.
 */
public final class StayRange implements Serializable {
    private static final long serialVersionUID = 1L;

    /** 최소 숙박일 수 */
    public static final int MIN_NIGHTS = 1;

    private final LocalDate checkIn;
    private final LocalDate checkOut;

    private StayRange(LocalDate checkIn, LocalDate checkOut) {
        this.checkIn = Objects.requireNonNull(checkIn, "checkIn은 null이 될 수 없습니다");
        this.checkOut = Objects.requireNonNull(checkOut, "checkOut은 null이 될 수 없습니다");
    }

    public static StayRange of(LocalDate checkIn, LocalDate checkOut) {
        return new StayRange(checkIn, checkOut);
    }

    /**
     * 두 날짜가 모두 있을 때만 StayRange를 만든다.
     */
    public static Optional<StayRange> ofNullable(LocalDate checkIn, LocalDate checkOut) {
        if (checkIn == null || checkOut == null) {
            return Optional.empty();
        }
        return Optional.of(new StayRange(checkIn, checkOut));
    }

    public LocalDate getCheckIn() {
        return checkIn;
    }

    public LocalDate getCheckOut() {
        return checkOut;
    }

    /**
     * 체크아웃이 체크인보다 뒤인지 확인
     */
    public boolean isOrdered() {
        return checkOut.isAfter(checkIn);
    }

    /**
     * 숙박일 수 (체크인~체크아웃 일수 차, 최소 1박)
     *
     * 예: 2025-06-01 ~ 2025-06-04 → 3박, 같은 날짜 또는 역순 → 1박
     */
    public int nights() {
        long days = ChronoUnit.DAYS.between(checkIn, checkOut);
        return (int) Math.max(MIN_NIGHTS, days);
    }

    /**
     * 반열린 구간 겹침 여부: [a,b)와 [c,d)는 a < d 이고 c < b 일 때 겹친다.
     * 인접한 기간 (b == c)은 겹치지 않는다.
     */
    public boolean overlaps(StayRange other) {
        Objects.requireNonNull(other, "other는 null이 될 수 없습니다");
        return this.checkIn.isBefore(other.checkOut) && other.checkIn.isBefore(this.checkOut);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof StayRange)) {
            return false;
        }
        StayRange that = (StayRange) o;
        return checkIn.equals(that.checkIn) && checkOut.equals(that.checkOut);
    }

    @Override
    public int hashCode() {
        return Objects.hash(checkIn, checkOut);
    }

    @Override
    public String toString() {
        return "[" + checkIn + ", " + checkOut + ")";
    }
}
