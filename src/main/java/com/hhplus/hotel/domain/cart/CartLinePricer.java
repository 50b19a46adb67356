package com.hhplus.hotel.domain.cart;

import com.hhplus.hotel.domain.common.ItemType;
import com.hhplus.hotel.domain.common.vo.StayRange;

import java.math.BigDecimal;
import java.util.List;

/**
 * CartLinePricer - 장바구니 라인 가격 계산 도메인 서비스 (순수 Java)
 *
 * 규칙:
 * - 객실 + 숙박 기간: 1박 요금 × max(1, 숙박일 수) × 수량
 * - 그 외: 단가 × 수량
 * - 장바구니 총액 = 라인 합계의 합
 */
public class CartLinePricer {

    public PricedCartLine price(CartItem item, String itemName, BigDecimal unitPrice, List<String> images) {
        ItemType itemType = item.getItemType();
        StayRange stayRange = itemType == ItemType.ROOM ? item.getStayRange() : null;

        return PricedCartLine.builder()
                .cartItemId(item.getCartItemId())
                .itemType(itemType)
                .itemId(item.getItemId())
                .itemName(itemName)
                .unitPrice(unitPrice)
                .quantity(item.getQuantity())
                .stayRange(stayRange)
                .nights(itemType.nights(stayRange))
                .lineTotal(itemType.lineTotal(unitPrice, item.getQuantity(), stayRange))
                .images(images != null ? List.copyOf(images) : List.of())
                .createdAt(item.getCreatedAt())
                .build();
    }

    public BigDecimal total(List<PricedCartLine> lines) {
        return lines.stream()
                .map(PricedCartLine::getLineTotal)
                .reduce(BigDecimal.ZERO.setScale(ItemType.AMOUNT_SCALE), BigDecimal::add);
    }
}
