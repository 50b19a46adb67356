package com.hhplus.hotel.domain.order;

import com.hhplus.hotel.common.exception.DomainException;
import com.hhplus.hotel.common.exception.ErrorCode;

/**
 * 취소된 주문의 상태를 다른 값으로 바꾸려 할 때 발생하는 예외 (400 Bad Request)
 */
public class InvalidOrderStatusException extends DomainException {

    public InvalidOrderStatusException(Long orderId, OrderStatus current, OrderStatus requested) {
        super(ErrorCode.INVALID_ORDER_TRANSITION,
                "Order ID: " + orderId + ", " + current.name() + " → " + requested.name());
    }
}
