package com.hhplus.hotel.infrastructure.persistence.order;

import com.hhplus.hotel.domain.order.Order;
import com.hhplus.hotel.domain.order.OrderRepository;
import com.hhplus.hotel.domain.order.OrderStatus;
import jakarta.persistence.EntityManager;
import jakarta.persistence.TypedQuery;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * MySQL 기반 Order Repository 구현
 *
 * 관리자 목록 조회는 임의의 offset/limit을 지원해야 하므로
 * EntityManager로 직접 JPQL을 실행한다.
 */
@Repository
public class MySQLOrderRepository implements OrderRepository {

    private final OrderJpaRepository orderJpaRepository;
    private final EntityManager entityManager;

    public MySQLOrderRepository(OrderJpaRepository orderJpaRepository, EntityManager entityManager) {
        this.orderJpaRepository = orderJpaRepository;
        this.entityManager = entityManager;
    }

    @Override
    public Order saveAndFlush(Order order) {
        return orderJpaRepository.saveAndFlush(order);
    }

    @Override
    public Optional<Order> findById(Long orderId) {
        return orderJpaRepository.findById(orderId);
    }

    @Override
    public Optional<Order> findByIdWithItems(Long orderId) {
        return orderJpaRepository.findByIdWithItems(orderId);
    }

    @Override
    public List<Order> findByCustomerIdWithItems(Long customerId) {
        return orderJpaRepository.findByCustomerIdWithItems(customerId);
    }

    /**
     * limit이 0이면 전체를 반환한다.
     */
    @Override
    public List<Order> findAll(OrderStatus status, int limit, int offset) {
        String jpql = "SELECT o FROM Order o" +
                (status != null ? " WHERE o.status = :status" : "") +
                " ORDER BY o.createdAt DESC, o.orderId DESC";

        TypedQuery<Order> query = entityManager.createQuery(jpql, Order.class);
        if (status != null) {
            query.setParameter("status", status);
        }
        query.setFirstResult(offset);
        if (limit > 0) {
            query.setMaxResults(limit);
        }
        return query.getResultList();
    }

    @Override
    public long count(OrderStatus status) {
        return status != null ? orderJpaRepository.countByStatus(status) : orderJpaRepository.count();
    }
}
