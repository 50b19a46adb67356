package com.hhplus.hotel.domain.cart;

import com.hhplus.hotel.domain.common.ItemType;
import com.hhplus.hotel.domain.common.vo.StayRange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CartLinePricer 테스트")
class CartLinePricerTest {

    private final CartLinePricer pricer = new CartLinePricer();

    @Test
    @DisplayName("객실 라인 가격 계산 및 예약 대상 여부")
    void testPrice_Room() {
        StayRange stay = StayRange.of(LocalDate.of(2025, 6, 1), LocalDate.of(2025, 6, 4));
        CartItem item = CartItem.create(1L, ItemType.ROOM, 2L, 2, stay);

        PricedCartLine line = pricer.price(item, "Deluxe Double Room", new BigDecimal("149.99"), List.of("a.jpg"));

        assertEquals(3, line.getNights());
        assertEquals(new BigDecimal("899.94"), line.getLineTotal());
        assertTrue(line.requiresBooking());
        assertEquals(List.of("a.jpg"), line.getImages());
    }

    @Test
    @DisplayName("숙박 기간 없는 객실 라인 - 1박으로 표시되고 예약 대상이 아니다")
    void testPrice_RoomWithoutStay() {
        CartItem item = CartItem.create(1L, ItemType.ROOM, 2L, 1, null);

        PricedCartLine line = pricer.price(item, "Cozy Single Room", new BigDecimal("89.99"), null);

        assertEquals(1, line.getNights());
        assertEquals(new BigDecimal("89.99"), line.getLineTotal());
        assertFalse(line.requiresBooking());
    }

    @Test
    @DisplayName("총액 - 라인 합계의 합, 빈 목록은 0.00")
    void testTotal() {
        PricedCartLine shirt = pricer.price(CartItem.create(1L, ItemType.PRODUCT, 1L, 2, null),
                "Hotel T-Shirt", new BigDecimal("24.99"), null);
        PricedCartLine coffee = pricer.price(CartItem.create(1L, ItemType.PRODUCT, 2L, 1, null),
                "Local Coffee Beans", new BigDecimal("18.99"), null);

        assertEquals(new BigDecimal("68.97"), pricer.total(List.of(shirt, coffee)));
        assertEquals(new BigDecimal("0.00"), pricer.total(List.of()));
        assertTrue(shirt.getImages().isEmpty());
    }
}
