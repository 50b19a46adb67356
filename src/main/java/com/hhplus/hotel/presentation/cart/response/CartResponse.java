package com.hhplus.hotel.presentation.cart.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * 장바구니 조회 응답 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartResponse {

    @JsonProperty("cart_items")
    private List<CartItemResponse> cartItems;

    @JsonProperty("total_amount")
    private BigDecimal totalAmount;

    @JsonProperty("item_count")
    private int itemCount;

    @JsonProperty("user_id")
    private Long userId;
}
