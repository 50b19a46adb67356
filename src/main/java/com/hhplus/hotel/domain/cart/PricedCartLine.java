package com.hhplus.hotel.domain.cart;

import com.hhplus.hotel.domain.common.ItemType;
import com.hhplus.hotel.domain.common.vo.StayRange;
import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * PricedCartLine - 현재 카탈로그 가격이 적용된 장바구니 라인 (불변)
 *
 * 장바구니 조회 응답과 주문 생성(OrderItem 스냅샷)에 공통으로 사용된다.
 */
@Getter
@Builder
public class PricedCartLine {
    private final Long cartItemId;
    private final ItemType itemType;
    private final Long itemId;
    private final String itemName;
    private final BigDecimal unitPrice;
    private final int quantity;
    private final StayRange stayRange;
    private final Integer nights;
    private final BigDecimal lineTotal;
    private final List<String> images;
    private final LocalDateTime createdAt;

    /**
     * 객실 예약 생성 대상 라인인지 (객실 + 숙박 기간 존재)
     */
    public boolean requiresBooking() {
        return itemType.createsBooking(stayRange);
    }
}
