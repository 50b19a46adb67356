package com.hhplus.hotel.application.order;

import com.hhplus.hotel.application.cart.CartLineReader;
import com.hhplus.hotel.application.order.dto.PlaceOrderResult;
import com.hhplus.hotel.domain.booking.RoomBooking;
import com.hhplus.hotel.domain.booking.RoomBookingRepository;
import com.hhplus.hotel.domain.cart.CartRepository;
import com.hhplus.hotel.domain.cart.PricedCartLine;
import com.hhplus.hotel.domain.order.ContactInfo;
import com.hhplus.hotel.domain.order.EmptyCartException;
import com.hhplus.hotel.domain.order.Order;
import com.hhplus.hotel.domain.order.OrderConstants;
import com.hhplus.hotel.domain.order.OrderItem;
import com.hhplus.hotel.domain.order.OrderRepository;
import com.hhplus.hotel.domain.order.event.OrderPlacedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

/**
 * OrderTransactionService - 체크아웃 트랜잭션 처리 서비스 (Application 계층)
 *
 * 역할:
 * - OrderService와 분리되어 @Transactional이 프록시를 통해 적용되도록 한다
 * - 장바구니 읽기, 주문/항목/예약 저장, 장바구니 비우기를 하나의 트랜잭션으로 처리
 *
 * 아키텍처:
 * OrderService (입력 변환, 예외 변환)
 *     ↓
 * OrderTransactionService (@Transactional 처리)
 *     ↓ (커밋 후)
 * OrderNotificationListener (비동기 알림)
 *
 * 동시성:
 * - 객실/날짜 잠금을 잡지 않으므로 같은 객실의 겹치는 예약이 동시에 생길 수 있다
 *   (예약 가능 여부 조회는 참고용)
 */
@Service
public class OrderTransactionService {

    private static final Logger log = LoggerFactory.getLogger(OrderTransactionService.class);

    private final CartLineReader cartLineReader;
    private final CartRepository cartRepository;
    private final OrderRepository orderRepository;
    private final RoomBookingRepository roomBookingRepository;
    private final OrderNumberGenerator orderNumberGenerator;
    private final ApplicationEventPublisher eventPublisher;

    public OrderTransactionService(CartLineReader cartLineReader,
                                   CartRepository cartRepository,
                                   OrderRepository orderRepository,
                                   RoomBookingRepository roomBookingRepository,
                                   OrderNumberGenerator orderNumberGenerator,
                                   ApplicationEventPublisher eventPublisher) {
        this.cartLineReader = cartLineReader;
        this.cartRepository = cartRepository;
        this.orderRepository = orderRepository;
        this.roomBookingRepository = roomBookingRepository;
        this.orderNumberGenerator = orderNumberGenerator;
        this.eventPublisher = eventPublisher;
    }

    /**
     * 체크아웃 (원자적)
     *
     * 1. 장바구니 라인을 현재 가격으로 읽기 (비어 있으면 EmptyCartException, 부작용 없음)
     * 2. 주문 + 항목 스냅샷 저장 (상태 PENDING, 총액 = 라인 합계의 합)
     * 3. 객실 + 숙박 기간 항목마다 RoomBooking 저장 (CONFIRMED)
     * 4. 장바구니 비우기
     * 5. OrderPlacedEvent 발행 (리스너는 커밋 후 실행)
     *
     * 어느 단계든 실패하면 전체 롤백된다.
     */
    @Transactional(isolation = Isolation.READ_COMMITTED, timeout = OrderConstants.CHECKOUT_TIMEOUT_SECONDS,
            rollbackFor = Exception.class)
    public PlaceOrderResult placeOrder(Long customerId, ContactInfo contactInfo, String notes) {
        List<PricedCartLine> lines = cartLineReader.readLines(customerId);
        if (lines.isEmpty()) {
            throw new EmptyCartException(customerId);
        }

        String orderNumber = orderNumberGenerator.generate(customerId);
        Order order = orderRepository.saveAndFlush(
                Order.place(customerId, orderNumber, contactInfo, notes, lines));

        List<RoomBooking> bookings = order.getOrderItems().stream()
                .filter(OrderItem::requiresBooking)
                .map(RoomBooking::forOrderItem)
                .collect(Collectors.toList());
        if (!bookings.isEmpty()) {
            roomBookingRepository.saveAll(bookings);
        }

        // 장바구니 삭제는 영속성 컨텍스트를 비우므로 이벤트와 결과를 먼저 만든다
        OrderPlacedEvent event = OrderPlacedEvent.from(order);
        PlaceOrderResult result = PlaceOrderResult.of(order, bookings.size());

        cartRepository.deleteByCustomerId(customerId);
        eventPublisher.publishEvent(event);

        log.info("[OrderTransactionService] 주문 생성 - orderId={}, orderNumber={}, total={}, items={}, bookings={}",
                result.getOrderId(), result.getOrderNumber(), result.getTotalAmount(),
                result.getItemCount(), result.getBookingCount());
        return result;
    }
}
