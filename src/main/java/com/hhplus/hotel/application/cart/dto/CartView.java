package com.hhplus.hotel.application.cart.dto;

import com.hhplus.hotel.domain.cart.PricedCartLine;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.List;

/**
 * 장바구니 조회 결과 (현재 카탈로그 가격 기준)
 */
@Getter
@AllArgsConstructor
public class CartView {
    private final Long customerId;
    private final List<PricedCartLine> lines;
    private final BigDecimal totalAmount;

    public int getItemCount() {
        return lines.size();
    }
}
