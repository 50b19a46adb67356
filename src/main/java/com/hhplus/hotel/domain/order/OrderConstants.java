package com.hhplus.hotel.domain.order;

/**
 * OrderConstants - 주문 도메인 상수
 */
public class OrderConstants {

    /** 주문 번호 접두사 */
    public static final String ORDER_NUMBER_PREFIX = "ORD";

    /** 주문 번호 임의 토큰 길이 */
    public static final int ORDER_NUMBER_TOKEN_LENGTH = 8;

    /** 체크아웃 트랜잭션 제한 시간 (초) */
    public static final int CHECKOUT_TIMEOUT_SECONDS = 5;

    private OrderConstants() {
        throw new AssertionError("OrderConstants는 인스턴스화할 수 없습니다");
    }
}
