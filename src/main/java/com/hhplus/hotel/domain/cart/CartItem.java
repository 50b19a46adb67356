package com.hhplus.hotel.domain.cart;

import com.hhplus.hotel.domain.common.ItemType;
import com.hhplus.hotel.domain.common.vo.StayRange;
import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * CartItem 도메인 엔티티
 *
 * 사용자별 장바구니 라인 (객실 숙박 또는 상품).
 * 가격은 저장하지 않고 조회/주문 시점의 카탈로그 가격으로 계산한다.
 *
 * 핵심 비즈니스 규칙:
 * - (사용자, 유형, 항목, 체크인, 체크아웃)이 같은 라인은 하나만 존재 (추가 시 수량 합산)
 * - 수량은 1 이상 1000 이하
 * - 상품 라인은 숙박 기간을 갖지 않음
 */
@Entity
@Table(name = "cart_items", uniqueConstraints = {
    @UniqueConstraint(name = "uk_cart_items_line",
            columnNames = {"user_id", "item_type", "item_id", "check_in_date", "check_out_date"})
})
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartItem {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long cartItemId;

    @Column(name = "user_id", nullable = false)
    private Long customerId;

    @Enumerated(EnumType.STRING)
    @Column(name = "item_type", nullable = false, length = 20)
    private ItemType itemType;

    @Column(name = "item_id", nullable = false)
    private Long itemId;

    @Column(name = "quantity", nullable = false)
    private Integer quantity;

    @Column(name = "check_in_date")
    private LocalDate checkInDate;

    @Column(name = "check_out_date")
    private LocalDate checkOutDate;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * 장바구니 라인 생성 팩토리 메서드
     *
     * @param stayRange 객실 숙박 기간 (nullable, 상품 라인에서는 무시)
     */
    public static CartItem create(Long customerId, ItemType itemType, Long itemId, int quantity, StayRange stayRange) {
        validateQuantity(quantity);
        StayRange effective = itemType == ItemType.ROOM ? stayRange : null;

        LocalDateTime now = LocalDateTime.now();
        return CartItem.builder()
                .customerId(customerId)
                .itemType(itemType)
                .itemId(itemId)
                .quantity(quantity)
                .checkInDate(effective != null ? effective.getCheckIn() : null)
                .checkOutDate(effective != null ? effective.getCheckOut() : null)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * 같은 라인 재추가 시 수량 합산
     *
     * @throws InvalidQuantityException 합산 결과가 최대 수량 초과
     */
    public void increaseQuantity(int additional) {
        validateQuantity(additional);
        int merged = this.quantity + additional;
        if (merged > CartConstants.MAX_CART_QUANTITY) {
            throw new InvalidQuantityException(merged);
        }
        this.quantity = merged;
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * 숙박 기간 (두 날짜가 모두 있을 때만)
     */
    public StayRange getStayRange() {
        return StayRange.ofNullable(checkInDate, checkOutDate).orElse(null);
    }

    public boolean isOwnedBy(Long customerId) {
        return this.customerId != null && this.customerId.equals(customerId);
    }

    private static void validateQuantity(int quantity) {
        if (quantity < CartConstants.MIN_CART_QUANTITY || quantity > CartConstants.MAX_CART_QUANTITY) {
            throw new InvalidQuantityException(quantity);
        }
    }
}
