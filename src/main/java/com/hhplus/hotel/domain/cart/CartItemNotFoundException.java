package com.hhplus.hotel.domain.cart;

import com.hhplus.hotel.common.exception.DomainException;
import com.hhplus.hotel.common.exception.ErrorCode;

/**
 * 장바구니 항목을 찾을 수 없을 때 발생하는 예외
 * 다른 사용자의 항목도 같은 예외로 처리한다.
 */
public class CartItemNotFoundException extends DomainException {

    public CartItemNotFoundException(Long cartItemId) {
        super(ErrorCode.CART_ITEM_NOT_FOUND, "Cart Item ID: " + cartItemId);
    }
}
