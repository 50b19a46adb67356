package com.hhplus.hotel.infrastructure.persistence.booking;

import com.hhplus.hotel.domain.booking.BookingStatus;
import com.hhplus.hotel.domain.booking.RoomBooking;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;

/**
 * RoomBooking JPA Repository
 */
public interface RoomBookingJpaRepository extends JpaRepository<RoomBooking, Long> {

    List<RoomBooking> findByOrderIdOrderByBookingIdAsc(Long orderId);

    /**
     * 반열린 구간 겹침: b.checkIn < :checkOut AND :checkIn < b.checkOut
     */
    @Query("SELECT COUNT(b) FROM RoomBooking b " +
           "WHERE b.roomId = :roomId " +
           "AND b.status IN :statuses " +
           "AND b.checkInDate < :checkOut " +
           "AND :checkIn < b.checkOutDate")
    long countOverlapping(@Param("roomId") Long roomId,
                          @Param("checkIn") LocalDate checkIn,
                          @Param("checkOut") LocalDate checkOut,
                          @Param("statuses") Collection<BookingStatus> statuses);
}
