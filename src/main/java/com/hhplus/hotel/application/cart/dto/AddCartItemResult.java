package com.hhplus.hotel.application.cart.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 장바구니 추가 결과
 * created=false면 기존 라인의 수량이 증가한 경우
 */
@Getter
@AllArgsConstructor
public class AddCartItemResult {
    private final Long cartItemId;
    private final boolean created;
}
