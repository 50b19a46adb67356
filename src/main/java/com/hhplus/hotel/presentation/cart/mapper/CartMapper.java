package com.hhplus.hotel.presentation.cart.mapper;

import com.hhplus.hotel.application.cart.dto.AddCartItemCommand;
import com.hhplus.hotel.application.cart.dto.AddCartItemResult;
import com.hhplus.hotel.application.cart.dto.CartView;
import com.hhplus.hotel.presentation.cart.request.AddCartItemRequest;
import com.hhplus.hotel.presentation.cart.response.AddCartItemResponse;
import com.hhplus.hotel.presentation.cart.response.CartItemResponse;
import com.hhplus.hotel.presentation.cart.response.CartResponse;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

/**
 * CartMapper - Presentation layer와 Application layer 간의 DTO 변환
 */
@Component
public class CartMapper {

    public AddCartItemCommand toAddCartItemCommand(AddCartItemRequest request) {
        return AddCartItemCommand.builder()
                .itemType(request.getItemType())
                .itemId(request.getItemId())
                .quantity(request.getQuantity())
                .checkInDate(request.getCheckInDate())
                .checkOutDate(request.getCheckOutDate())
                .build();
    }

    public CartResponse toCartResponse(CartView view) {
        return CartResponse.builder()
                .cartItems(view.getLines().stream()
                        .map(CartItemResponse::from)
                        .collect(Collectors.toList()))
                .totalAmount(view.getTotalAmount())
                .itemCount(view.getItemCount())
                .userId(view.getCustomerId())
                .build();
    }

    public AddCartItemResponse toAddCartItemResponse(AddCartItemResult result) {
        String message = result.isCreated() ? "Item added to cart" : "Cart item quantity updated";
        return new AddCartItemResponse(message, result.getCartItemId());
    }
}
