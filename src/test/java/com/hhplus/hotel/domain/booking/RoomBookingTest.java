package com.hhplus.hotel.domain.booking;

import com.hhplus.hotel.domain.order.Order;
import com.hhplus.hotel.domain.order.OrderFixtures;
import com.hhplus.hotel.domain.order.OrderItem;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RoomBooking 도메인 테스트")
class RoomBookingTest {

    @Test
    @DisplayName("예약 생성 - 객실 항목의 기간과 수량을 따른다")
    void testForOrderItem() {
        Order order = OrderFixtures.placedOrder(1L);
        OrderItem roomItem = order.getOrderItems().get(0);

        RoomBooking booking = RoomBooking.forOrderItem(roomItem);

        assertEquals(roomItem.getItemId(), booking.getRoomId());
        assertEquals(OrderFixtures.STAY, booking.getStayRange());
        assertEquals(1, booking.getGuestCount());
        assertEquals(BookingStatus.CONFIRMED, booking.getStatus());
    }

    @Test
    @DisplayName("예약 생성 실패 - 상품 항목")
    void testForOrderItem_Product() {
        OrderItem productItem = OrderFixtures.placedOrder(1L).getOrderItems().get(1);

        assertThrows(IllegalArgumentException.class, () -> RoomBooking.forOrderItem(productItem));
    }

    @Test
    @DisplayName("예약 취소 - 멱등")
    void testCancel_Idempotent() {
        RoomBooking booking = RoomBooking.forOrderItem(OrderFixtures.placedOrder(1L).getOrderItems().get(0));

        assertTrue(booking.cancel());
        assertFalse(booking.cancel());
        assertEquals(BookingStatus.CANCELLED, booking.getStatus());
    }
}
