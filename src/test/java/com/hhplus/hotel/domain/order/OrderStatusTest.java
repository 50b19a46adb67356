package com.hhplus.hotel.domain.order;

import com.hhplus.hotel.common.exception.DomainException;
import com.hhplus.hotel.common.exception.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("OrderStatus 테스트")
class OrderStatusTest {

    @ParameterizedTest
    @ValueSource(strings = {"cancelled", "CANCELLED", "Cancelled"})
    @DisplayName("문자열 변환 - 대소문자 무시")
    void testFromString(String value) {
        assertEquals(OrderStatus.CANCELLED, OrderStatus.fromString(value));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", " ", "shipped"})
    @DisplayName("문자열 변환 실패 - INVALID_ORDER_STATUS")
    void testFromString_Invalid(String value) {
        DomainException exception = assertThrows(DomainException.class, () -> OrderStatus.fromString(value));
        assertEquals(ErrorCode.INVALID_ORDER_STATUS, exception.getErrorCode());
    }

    @Test
    @DisplayName("응답 코드는 소문자")
    void testGetCode() {
        assertEquals("pending", OrderStatus.PENDING.getCode());
        assertEquals("completed", OrderStatus.COMPLETED.getCode());
    }
}
