package com.hhplus.hotel.application.order.dto;

import com.hhplus.hotel.domain.order.Order;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 주문 생성 결과
 */
@Getter
@AllArgsConstructor
public class PlaceOrderResult {
    private final Long orderId;
    private final String orderNumber;
    private final BigDecimal totalAmount;
    private final int itemCount;
    private final int bookingCount;
    private final LocalDateTime createdAt;

    public static PlaceOrderResult of(Order order, int bookingCount) {
        return new PlaceOrderResult(
                order.getOrderId(),
                order.getOrderNumber(),
                order.getTotalAmount(),
                order.getOrderItemCount(),
                bookingCount,
                order.getCreatedAt()
        );
    }
}
