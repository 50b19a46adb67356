package com.hhplus.hotel.domain.order;

import com.hhplus.hotel.domain.cart.PricedCartLine;
import com.hhplus.hotel.domain.common.ItemType;
import com.hhplus.hotel.domain.common.vo.StayRange;
import jakarta.persistence.*;
import lombok.*;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * OrderItem 도메인 엔티티
 *
 * 책임:
 * - 주문 시점의 항목 정보 스냅샷 (이름, 단가, 숙박 기간, 숙박일 수)
 * - 항목 합계 보존
 *
 * 핵심 비즈니스 규칙:
 * - 생성 후 변경되지 않음 (setter 없음)
 * - 이후 카탈로그 가격이 바뀌어도 주문 당시 금액 유지
 */
@Entity
@Table(name = "order_items")
@Getter
@Builder(access = AccessLevel.PRIVATE)
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class OrderItem {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long orderItemId;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "order_id", nullable = false)
    private Order order;

    @Enumerated(EnumType.STRING)
    @Column(name = "item_type", nullable = false, length = 20)
    private ItemType itemType;

    @Column(name = "item_id", nullable = false)
    private Long itemId;

    @Column(name = "item_name", nullable = false)
    private String itemName;

    @Column(name = "quantity", nullable = false)
    private Integer quantity;

    @Column(name = "unit_price", nullable = false, precision = 10, scale = 2)
    private BigDecimal unitPrice;

    @Column(name = "total_price", nullable = false, precision = 10, scale = 2)
    private BigDecimal totalPrice;

    @Column(name = "check_in_date")
    private LocalDate checkInDate;

    @Column(name = "check_out_date")
    private LocalDate checkOutDate;

    @Column(name = "nights")
    private Integer nights;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    /**
     * 가격이 계산된 장바구니 라인으로부터 스냅샷 생성
     */
    static OrderItem snapshotOf(Order order, PricedCartLine line) {
        StayRange stayRange = line.getStayRange();
        return OrderItem.builder()
                .order(order)
                .itemType(line.getItemType())
                .itemId(line.getItemId())
                .itemName(line.getItemName())
                .quantity(line.getQuantity())
                .unitPrice(line.getUnitPrice())
                .totalPrice(line.getLineTotal())
                .checkInDate(stayRange != null ? stayRange.getCheckIn() : null)
                .checkOutDate(stayRange != null ? stayRange.getCheckOut() : null)
                .nights(line.getNights())
                .createdAt(LocalDateTime.now())
                .build();
    }

    public StayRange getStayRange() {
        return StayRange.ofNullable(checkInDate, checkOutDate).orElse(null);
    }

    /**
     * 객실 예약이 필요한 항목인지
     */
    public boolean requiresBooking() {
        return itemType.createsBooking(getStayRange());
    }
}
