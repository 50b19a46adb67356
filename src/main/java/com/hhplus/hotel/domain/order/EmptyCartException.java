package com.hhplus.hotel.domain.order;

import com.hhplus.hotel.common.exception.DomainException;
import com.hhplus.hotel.common.exception.ErrorCode;

/**
 * 빈 장바구니로 주문하려 할 때 발생하는 예외
 */
public class EmptyCartException extends DomainException {

    public EmptyCartException(Long customerId) {
        super(ErrorCode.EMPTY_CART, "User ID: " + customerId);
    }
}
