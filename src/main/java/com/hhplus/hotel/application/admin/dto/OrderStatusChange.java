package com.hhplus.hotel.application.admin.dto;

import com.hhplus.hotel.domain.order.OrderStatus;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 주문 상태 변경 결과
 */
@Getter
@AllArgsConstructor
public class OrderStatusChange {
    private final Long orderId;
    private final OrderStatus status;
    private final int cancelledBookings;
}
