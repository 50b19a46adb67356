package com.hhplus.hotel.domain.booking;

import com.hhplus.hotel.domain.common.vo.StayRange;

import java.util.List;

/**
 * RoomBooking Repository Interface (Domain Layer - Port)
 */
public interface RoomBookingRepository {

    List<RoomBooking> saveAll(List<RoomBooking> bookings);

    List<RoomBooking> findByOrderId(Long orderId);

    /**
     * 기간이 겹치는 점유 예약 수 (CONFIRMED, CHECKED_IN)
     * 겹침: existing.checkIn < stay.checkOut AND stay.checkIn < existing.checkOut
     */
    long countOverlapping(Long roomId, StayRange stayRange);
}
