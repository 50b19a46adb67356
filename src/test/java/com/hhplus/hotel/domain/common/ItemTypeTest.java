package com.hhplus.hotel.domain.common;

import com.hhplus.hotel.common.exception.DomainException;
import com.hhplus.hotel.common.exception.ErrorCode;
import com.hhplus.hotel.domain.common.vo.StayRange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ItemType 가격 규칙 테스트")
class ItemTypeTest {

    private static final StayRange THREE_NIGHTS = StayRange.of(LocalDate.of(2025, 6, 1), LocalDate.of(2025, 6, 4));

    @Test
    @DisplayName("객실 합계 - 1박 요금 × 숙박일 수 × 수량")
    void testRoomLineTotal_WithStay() {
        BigDecimal total = ItemType.ROOM.lineTotal(new BigDecimal("149.99"), 2, THREE_NIGHTS);

        assertEquals(new BigDecimal("899.94"), total);
    }

    @Test
    @DisplayName("객실 합계 - 숙박 기간이 없으면 1박으로 계산")
    void testRoomLineTotal_WithoutStay() {
        BigDecimal total = ItemType.ROOM.lineTotal(new BigDecimal("89.99"), 1, null);

        assertEquals(new BigDecimal("89.99"), total);
        assertEquals(1, ItemType.ROOM.nights(null));
        assertFalse(ItemType.ROOM.createsBooking(null));
    }

    @Test
    @DisplayName("상품 합계 - 숙박 기간은 무시된다")
    void testProductLineTotal_IgnoresStay() {
        BigDecimal total = ItemType.PRODUCT.lineTotal(new BigDecimal("24.99"), 3, THREE_NIGHTS);

        assertEquals(new BigDecimal("74.97"), total);
        assertNull(ItemType.PRODUCT.nights(THREE_NIGHTS));
        assertFalse(ItemType.PRODUCT.createsBooking(THREE_NIGHTS));
    }

    @ParameterizedTest
    @ValueSource(strings = {"room", "ROOM", " Room "})
    @DisplayName("문자열 변환 - 대소문자 무시")
    void testFrom_CaseInsensitive(String value) {
        assertEquals(ItemType.ROOM, ItemType.from(value));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "service", "rooms"})
    @DisplayName("문자열 변환 - 알 수 없는 유형은 INVALID_ITEM_TYPE")
    void testFrom_Invalid(String value) {
        DomainException exception = assertThrows(DomainException.class, () -> ItemType.from(value));
        assertEquals(ErrorCode.INVALID_ITEM_TYPE, exception.getErrorCode());
    }
}
