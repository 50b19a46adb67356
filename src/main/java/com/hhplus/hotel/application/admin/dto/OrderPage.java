package com.hhplus.hotel.application.admin.dto;

import com.hhplus.hotel.domain.order.Order;
import com.hhplus.hotel.domain.order.OrderStatus;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * 관리자 주문 목록 조회 결과
 * totalCount는 limit/offset과 무관한 상태 필터 기준 전체 건수
 */
@Getter
@AllArgsConstructor
public class OrderPage {
    private final List<Order> orders;
    private final long totalCount;
    private final OrderStatus status;
}
