package com.hhplus.hotel.application.admin;

import com.hhplus.hotel.application.admin.dto.OrderPage;
import com.hhplus.hotel.application.admin.dto.OrderStatusChange;
import com.hhplus.hotel.common.exception.DomainException;
import com.hhplus.hotel.common.exception.ErrorCode;
import com.hhplus.hotel.domain.booking.RoomBooking;
import com.hhplus.hotel.domain.booking.RoomBookingRepository;
import com.hhplus.hotel.domain.order.InvalidOrderStatusException;
import com.hhplus.hotel.domain.order.Order;
import com.hhplus.hotel.domain.order.OrderNotFoundException;
import com.hhplus.hotel.domain.order.OrderRepository;
import com.hhplus.hotel.domain.order.OrderStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * OrderAdminService - 관리자 주문 관리 Application 서비스
 *
 * 주문 취소 시 같은 트랜잭션에서 해당 주문의 객실 예약을 모두 취소한다.
 */
@Slf4j
@Service
public class OrderAdminService {

    private final OrderRepository orderRepository;
    private final RoomBookingRepository roomBookingRepository;

    public OrderAdminService(OrderRepository orderRepository, RoomBookingRepository roomBookingRepository) {
        this.orderRepository = orderRepository;
        this.roomBookingRepository = roomBookingRepository;
    }

    /**
     * 전체 주문 목록 (최신순)
     *
     * @param status null 또는 공백이면 전체
     * @param limit 0이면 제한 없음
     * @throws DomainException INVALID_ORDER_STATUS, INVALID_REQUEST (음수 limit/offset)
     */
    @Transactional(readOnly = true)
    public OrderPage getOrders(String status, int limit, int offset) {
        if (limit < 0 || offset < 0) {
            throw new DomainException(ErrorCode.INVALID_REQUEST, "limit, offset은 0 이상이어야 합니다");
        }
        OrderStatus filter = status == null || status.isBlank() ? null : OrderStatus.fromString(status);

        List<Order> orders = orderRepository.findAll(filter, limit, offset);
        return new OrderPage(orders, orderRepository.count(filter), filter);
    }

    /**
     * 주문 상태 변경
     *
     * - 상태 문자열은 대소문자 무시
     * - notes가 null이면 기존 요청사항 유지
     * - CANCELLED로 변경 시 취소되지 않은 예약을 모두 취소 (이미 취소된 주문 재요청은 변경 없음)
     *
     * @throws DomainException INVALID_ORDER_STATUS
     * @throws OrderNotFoundException 주문 없음
     * @throws InvalidOrderStatusException 취소된 주문을 다른 상태로 변경
     */
    @Transactional
    public OrderStatusChange updateStatus(Long orderId, String status, String notes) {
        OrderStatus newStatus = OrderStatus.fromString(status);
        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> new OrderNotFoundException(orderId));

        OrderStatus previous = order.getStatus();
        order.changeStatus(newStatus, notes);

        int cancelledBookings = 0;
        if (newStatus == OrderStatus.CANCELLED) {
            for (RoomBooking booking : roomBookingRepository.findByOrderId(orderId)) {
                if (booking.cancel()) {
                    cancelledBookings++;
                }
            }
        }

        log.info("[OrderAdminService] 주문 상태 변경 - orderId={}, {} → {}, cancelledBookings={}",
                orderId, previous, newStatus, cancelledBookings);
        return new OrderStatusChange(orderId, newStatus, cancelledBookings);
    }
}
