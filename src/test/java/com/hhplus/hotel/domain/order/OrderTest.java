package com.hhplus.hotel.domain.order;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Order 도메인 엔티티 순수 단위 테스트
 *
 * 테스트 대상:
 * - 주문 생성 (총액 계산, 항목 스냅샷)
 * - 상태 변경 규칙 (취소는 종료 상태)
 */
@DisplayName("Order 도메인 엔티티 순수 단위 테스트")
class OrderTest {

    private static final Long TEST_USER_ID = 1L;

    @Test
    @DisplayName("주문 생성 - 총액은 라인 합계의 합, 상태는 PENDING")
    void testPlace_Success() {
        Order order = OrderFixtures.placedOrder(TEST_USER_ID);

        assertEquals(new BigDecimal("499.95"), order.getTotalAmount());
        assertEquals(OrderStatus.PENDING, order.getStatus());
        assertEquals(2, order.getOrderItemCount());
        assertTrue(order.isOwnedBy(TEST_USER_ID));
        assertNotNull(order.getCreatedAt());
    }

    @Test
    @DisplayName("주문 생성 - 항목 스냅샷에 숙박 기간과 숙박일 수가 담긴다")
    void testPlace_SnapshotsItems() {
        Order order = OrderFixtures.placedOrder(TEST_USER_ID);

        OrderItem room = order.getOrderItems().get(0);
        assertEquals("Deluxe Double Room", room.getItemName());
        assertEquals(OrderFixtures.STAY, room.getStayRange());
        assertEquals(3, room.getNights());
        assertTrue(room.requiresBooking());

        OrderItem product = order.getOrderItems().get(1);
        assertNull(product.getStayRange());
        assertNull(product.getNights());
        assertFalse(product.requiresBooking());
        assertSame(order, product.getOrder());
    }

    @Test
    @DisplayName("주문 생성 실패 - 라인이 없으면 EmptyCartException")
    void testPlace_EmptyLines() {
        assertThrows(EmptyCartException.class,
                () -> Order.place(TEST_USER_ID, "ORD-X", OrderFixtures.contact(), null, List.of()));
    }

    @Test
    @DisplayName("상태 변경 - notes가 null이면 기존 요청사항 유지")
    void testChangeStatus_KeepsNotes() {
        Order order = Order.place(TEST_USER_ID, "ORD-X", OrderFixtures.contact(), "late check-in",
                List.of(OrderFixtures.productLine(1L)));

        boolean cancelledNow = order.changeStatus(OrderStatus.CONFIRMED, null);

        assertFalse(cancelledNow);
        assertEquals(OrderStatus.CONFIRMED, order.getStatus());
        assertEquals("late check-in", order.getNotes());
    }

    @Test
    @DisplayName("상태 변경 - 취소 시 true, 재취소는 false")
    void testChangeStatus_CancelIsIdempotent() {
        Order order = OrderFixtures.placedOrder(TEST_USER_ID);

        assertTrue(order.changeStatus(OrderStatus.CANCELLED, "customer request"));
        assertFalse(order.changeStatus(OrderStatus.CANCELLED, null));
        assertTrue(order.isCancelled());
        assertEquals("customer request", order.getNotes());
    }

    @Test
    @DisplayName("상태 변경 실패 - 취소된 주문은 다른 상태로 변경할 수 없다")
    void testChangeStatus_CancelledIsTerminal() {
        Order order = OrderFixtures.placedOrder(TEST_USER_ID);
        order.changeStatus(OrderStatus.CANCELLED, null);

        assertThrows(InvalidOrderStatusException.class, () -> order.changeStatus(OrderStatus.CONFIRMED, null));
        assertEquals(OrderStatus.CANCELLED, order.getStatus());
    }

    @Test
    @DisplayName("항목 목록은 외부에서 수정할 수 없다")
    void testOrderItems_Unmodifiable() {
        Order order = OrderFixtures.placedOrder(TEST_USER_ID);

        assertThrows(UnsupportedOperationException.class, () -> order.getOrderItems().clear());
    }
}
