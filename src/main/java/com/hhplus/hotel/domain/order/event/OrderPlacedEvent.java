package com.hhplus.hotel.domain.order.event;

import com.hhplus.hotel.domain.order.Order;
import com.hhplus.hotel.domain.order.OrderItem;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 주문 생성 이벤트
 *
 * 용도: 주문 커밋 후 알림 발송을 트랜잭션 외부에서 비동기 처리
 * 발행 시점: OrderTransactionService.placeOrder() 내부 (리스너는 AFTER_COMMIT)
 * 리스너: OrderNotificationListener (비동기)
 *
 * 리스너가 DB를 다시 읽지 않도록 알림에 필요한 값을 스냅샷으로 담는다.
 */
@Getter
@ToString
public class OrderPlacedEvent {

    private final Long orderId;
    private final String orderNumber;
    private final String customerName;
    private final String customerPhone;
    private final String customerEmail;
    private final BigDecimal totalAmount;
    private final String status;
    private final List<Item> items;
    private final LocalDateTime occurredAt;

    public OrderPlacedEvent(Long orderId, String orderNumber, String customerName, String customerPhone,
                            String customerEmail, BigDecimal totalAmount, String status, List<Item> items) {
        this.orderId = orderId;
        this.orderNumber = orderNumber;
        this.customerName = customerName;
        this.customerPhone = customerPhone;
        this.customerEmail = customerEmail;
        this.totalAmount = totalAmount;
        this.status = status;
        this.items = List.copyOf(items);
        this.occurredAt = LocalDateTime.now();
    }

    /**
     * 저장된 주문으로부터 이벤트 생성
     * 알림 상태는 항상 "confirmed" (주문 접수 확인)
     */
    public static OrderPlacedEvent from(Order order) {
        List<Item> items = order.getOrderItems().stream()
                .map(Item::from)
                .collect(Collectors.toList());
        return new OrderPlacedEvent(
                order.getOrderId(),
                order.getOrderNumber(),
                order.getContactInfo().getCustomerName(),
                order.getContactInfo().getCustomerPhone(),
                order.getContactInfo().getCustomerEmail(),
                order.getTotalAmount(),
                "confirmed",
                items
        );
    }

    public boolean hasCustomerEmail() {
        return customerEmail != null && !customerEmail.isBlank();
    }

    @Getter
    @ToString
    public static class Item {
        private final String itemType;
        private final Long itemId;
        private final String itemName;
        private final int quantity;
        private final BigDecimal unitPrice;
        private final BigDecimal totalPrice;
        private final LocalDate checkInDate;
        private final LocalDate checkOutDate;
        private final Integer nights;

        public Item(String itemType, Long itemId, String itemName, int quantity, BigDecimal unitPrice,
                    BigDecimal totalPrice, LocalDate checkInDate, LocalDate checkOutDate, Integer nights) {
            this.itemType = itemType;
            this.itemId = itemId;
            this.itemName = itemName;
            this.quantity = quantity;
            this.unitPrice = unitPrice;
            this.totalPrice = totalPrice;
            this.checkInDate = checkInDate;
            this.checkOutDate = checkOutDate;
            this.nights = nights;
        }

        static Item from(OrderItem orderItem) {
            return new Item(
                    orderItem.getItemType().getCode(),
                    orderItem.getItemId(),
                    orderItem.getItemName(),
                    orderItem.getQuantity(),
                    orderItem.getUnitPrice(),
                    orderItem.getTotalPrice(),
                    orderItem.getCheckInDate(),
                    orderItem.getCheckOutDate(),
                    orderItem.getNights()
            );
        }
    }
}
