package com.hhplus.hotel.application.cart.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * 장바구니 항목 추가 커맨드 (Application layer 내부 DTO)
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AddCartItemCommand {
    private String itemType;
    private Long itemId;
    private Integer quantity;
    private LocalDate checkInDate;
    private LocalDate checkOutDate;
}
