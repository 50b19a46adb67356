package com.hhplus.hotel.domain.order;

import com.hhplus.hotel.domain.cart.PricedCartLine;
import com.hhplus.hotel.domain.common.ItemType;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Order 도메인 엔티티 (Rich Domain Model)
 *
 * 책임:
 * - 주문 항목 스냅샷과 총액 관리
 * - 주문 상태 전환
 *
 * 핵심 비즈니스 규칙:
 * - 주문 생성 시 최소 1개 이상의 항목 필요
 * - 총액 = 항목 합계의 합
 * - 생성 직후 상태는 PENDING
 * - CANCELLED는 종료 상태 (같은 상태로의 재요청은 무시)
 */
@Entity
@Table(name = "orders")
@Getter
@Builder(access = AccessLevel.PRIVATE)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Order {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long orderId;

    @Column(name = "user_id", nullable = false)
    private Long customerId;

    @Column(name = "order_number", nullable = false, unique = true, length = 50)
    private String orderNumber;

    @Column(name = "total_amount", nullable = false, precision = 10, scale = 2)
    private BigDecimal totalAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private OrderStatus status;

    @Embedded
    private ContactInfo contactInfo;

    @Column(name = "notes", columnDefinition = "TEXT")
    private String notes;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @OneToMany(mappedBy = "order", cascade = CascadeType.PERSIST, fetch = FetchType.LAZY)
    @OrderBy("orderItemId ASC")
    @Builder.Default
    private List<OrderItem> orderItems = new ArrayList<>();

    /**
     * 주문 생성 팩토리 메서드
     *
     * @param lines 가격이 계산된 장바구니 라인 (1개 이상)
     * @throws EmptyCartException 라인이 없는 경우
     */
    public static Order place(Long customerId, String orderNumber, ContactInfo contactInfo,
                              String notes, List<PricedCartLine> lines) {
        if (lines == null || lines.isEmpty()) {
            throw new EmptyCartException(customerId);
        }

        LocalDateTime now = LocalDateTime.now();
        Order order = Order.builder()
                .customerId(customerId)
                .orderNumber(orderNumber)
                .contactInfo(contactInfo)
                .notes(notes)
                .status(OrderStatus.PENDING)
                .createdAt(now)
                .updatedAt(now)
                .build();

        BigDecimal total = BigDecimal.ZERO.setScale(ItemType.AMOUNT_SCALE);
        for (PricedCartLine line : lines) {
            order.orderItems.add(OrderItem.snapshotOf(order, line));
            total = total.add(line.getLineTotal());
        }
        order.totalAmount = total;
        return order;
    }

    /**
     * 상태 변경
     *
     * @param newStatus 변경할 상태
     * @param notes 요청사항 (null이면 기존 값 유지)
     * @return 이번 호출로 주문이 취소 상태가 되었는지 여부
     * @throws InvalidOrderStatusException 취소된 주문을 다른 상태로 변경하려는 경우
     */
    public boolean changeStatus(OrderStatus newStatus, String notes) {
        if (this.status == OrderStatus.CANCELLED && newStatus != OrderStatus.CANCELLED) {
            throw new InvalidOrderStatusException(this.orderId, this.status, newStatus);
        }
        boolean cancelledNow = newStatus == OrderStatus.CANCELLED && this.status != OrderStatus.CANCELLED;

        this.status = newStatus;
        if (notes != null) {
            this.notes = notes;
        }
        this.updatedAt = LocalDateTime.now();
        return cancelledNow;
    }

    public boolean isOwnedBy(Long customerId) {
        return this.customerId != null && this.customerId.equals(customerId);
    }

    public boolean isCancelled() {
        return this.status == OrderStatus.CANCELLED;
    }

    public List<OrderItem> getOrderItems() {
        return Collections.unmodifiableList(orderItems);
    }

    public int getOrderItemCount() {
        return orderItems.size();
    }
}
