package com.hhplus.hotel.application.order.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 주문 생성 커맨드 (Application layer 내부 DTO)
 * 주문 항목은 요청이 아니라 사용자의 장바구니에서 읽는다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlaceOrderCommand {
    private String customerName;
    private String customerPhone;
    private String customerEmail;
    private String notes;
}
