package com.hhplus.hotel.infrastructure.persistence.booking;

import com.hhplus.hotel.domain.booking.BookingStatus;
import com.hhplus.hotel.domain.booking.RoomBooking;
import com.hhplus.hotel.domain.booking.RoomBookingRepository;
import com.hhplus.hotel.domain.common.vo.StayRange;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * MySQL 기반 RoomBooking Repository 구현
 */
@Repository
public class MySQLRoomBookingRepository implements RoomBookingRepository {

    private final RoomBookingJpaRepository roomBookingJpaRepository;

    public MySQLRoomBookingRepository(RoomBookingJpaRepository roomBookingJpaRepository) {
        this.roomBookingJpaRepository = roomBookingJpaRepository;
    }

    @Override
    public List<RoomBooking> saveAll(List<RoomBooking> bookings) {
        return roomBookingJpaRepository.saveAll(bookings);
    }

    @Override
    public List<RoomBooking> findByOrderId(Long orderId) {
        return roomBookingJpaRepository.findByOrderIdOrderByBookingIdAsc(orderId);
    }

    @Override
    public long countOverlapping(Long roomId, StayRange stayRange) {
        return roomBookingJpaRepository.countOverlapping(
                roomId, stayRange.getCheckIn(), stayRange.getCheckOut(), BookingStatus.OCCUPYING);
    }
}
