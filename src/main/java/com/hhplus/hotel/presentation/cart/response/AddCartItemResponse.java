package com.hhplus.hotel.presentation.cart.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class AddCartItemResponse {

    @JsonProperty("message")
    private String message;

    @JsonProperty("cart_item_id")
    private Long cartItemId;
}
