package com.hhplus.hotel.domain.order;

import java.util.List;
import java.util.Optional;

/**
 * OrderRepository - Order 도메인 영속성 Port Interface
 */
public interface OrderRepository {

    /**
     * 주문과 항목 저장 후 즉시 flush (항목 ID가 필요한 예약 생성을 위해)
     */
    Order saveAndFlush(Order order);

    Optional<Order> findById(Long orderId);

    /**
     * 주문 + 항목 조회
     */
    Optional<Order> findByIdWithItems(Long orderId);

    /**
     * 사용자별 주문 목록 (최신순, 항목 포함)
     */
    List<Order> findByCustomerIdWithItems(Long customerId);

    /**
     * 전체 주문 목록 (최신순, 상태 필터 선택)
     *
     * @param status null이면 전체
     */
    List<Order> findAll(OrderStatus status, int limit, int offset);

    long count(OrderStatus status);
}
