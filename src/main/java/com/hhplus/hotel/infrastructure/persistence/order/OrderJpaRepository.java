package com.hhplus.hotel.infrastructure.persistence.order;

import com.hhplus.hotel.domain.order.Order;
import com.hhplus.hotel.domain.order.OrderStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

/**
 * Order JPA Repository
 *
 * Order.orderItems는 LAZY이므로 항목이 필요한 조회는 fetch join을 사용한다.
 */
public interface OrderJpaRepository extends JpaRepository<Order, Long> {

    @Query("SELECT DISTINCT o FROM Order o " +
           "LEFT JOIN FETCH o.orderItems " +
           "WHERE o.orderId = :orderId")
    Optional<Order> findByIdWithItems(@Param("orderId") Long orderId);

    @Query("SELECT DISTINCT o FROM Order o " +
           "LEFT JOIN FETCH o.orderItems " +
           "WHERE o.customerId = :customerId " +
           "ORDER BY o.createdAt DESC, o.orderId DESC")
    List<Order> findByCustomerIdWithItems(@Param("customerId") Long customerId);

    long countByStatus(OrderStatus status);
}
