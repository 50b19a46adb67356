package com.hhplus.hotel.application.order;

import com.hhplus.hotel.application.order.dto.PlaceOrderCommand;
import com.hhplus.hotel.application.order.dto.PlaceOrderResult;
import com.hhplus.hotel.common.auth.CustomerPrincipal;
import com.hhplus.hotel.common.exception.ErrorCode;
import com.hhplus.hotel.common.exception.SystemException;
import com.hhplus.hotel.domain.order.ContactInfo;
import com.hhplus.hotel.domain.order.Order;
import com.hhplus.hotel.domain.order.OrderNotFoundException;
import com.hhplus.hotel.domain.order.OrderRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * OrderService - 주문 Application 서비스
 *
 * 역할:
 * - 체크아웃 요청을 OrderTransactionService에 위임하고 저장소 오류를 ORDER_CREATION_FAILED로 변환
 * - 본인 주문 조회
 *
 * 저장소 오류는 재시도하지 않는다.
 */
@Slf4j
@Service
public class OrderService {

    private final OrderTransactionService orderTransactionService;
    private final OrderRepository orderRepository;

    public OrderService(OrderTransactionService orderTransactionService,
                        OrderRepository orderRepository) {
        this.orderTransactionService = orderTransactionService;
        this.orderRepository = orderRepository;
    }

    /**
     * 장바구니로 주문 생성
     *
     * @throws com.hhplus.hotel.domain.order.EmptyCartException 장바구니가 비어 있음
     * @throws SystemException ORDER_CREATION_FAILED (저장소/트랜잭션 오류, 전체 롤백됨)
     */
    public PlaceOrderResult placeOrder(CustomerPrincipal customer, PlaceOrderCommand command) {
        ContactInfo contactInfo = ContactInfo.of(
                command.getCustomerName(), command.getCustomerPhone(), command.getCustomerEmail());
        String notes = command.getNotes() == null || command.getNotes().isBlank() ? null : command.getNotes();

        try {
            return orderTransactionService.placeOrder(customer.getCustomerId(), contactInfo, notes);
        } catch (DataAccessException | TransactionException e) {
            log.error("[OrderService] 주문 생성 실패 - userId={}", customer.getCustomerId(), e);
            throw new SystemException(ErrorCode.ORDER_CREATION_FAILED, e);
        }
    }

    /**
     * 본인 주문 목록 (최신순, 항목 포함)
     */
    @Transactional(readOnly = true)
    public List<Order> getOrders(CustomerPrincipal customer) {
        return orderRepository.findByCustomerIdWithItems(customer.getCustomerId());
    }

    /**
     * 본인 주문 단건 조회
     *
     * @throws OrderNotFoundException 주문이 없거나 다른 사용자의 주문
     */
    @Transactional(readOnly = true)
    public Order getOrder(CustomerPrincipal customer, Long orderId) {
        return orderRepository.findByIdWithItems(orderId)
                .filter(order -> order.isOwnedBy(customer.getCustomerId()))
                .orElseThrow(() -> new OrderNotFoundException(orderId));
    }
}
