package com.hhplus.hotel.domain.order;

import com.hhplus.hotel.common.exception.DomainException;
import com.hhplus.hotel.common.exception.ErrorCode;

/**
 * 주문을 찾을 수 없을 때 발생하는 예외
 * 다른 사용자의 주문 조회도 같은 예외로 응답한다.
 */
public class OrderNotFoundException extends DomainException {

    public OrderNotFoundException(Long orderId) {
        super(ErrorCode.ORDER_NOT_FOUND, "Order ID: " + orderId);
    }
}
