package com.hhplus.hotel.common.exception;

/**
 * ErrorCode - 비즈니스 예외 코드 정의
 *
 * 역할:
 * - 모든 비즈니스 예외의 코드와 메시지 정의
 * - HTTP 상태 코드 매핑
 * - 일관된 에러 응답 제공
 *
 * 분류:
 * - 400: 잘못된 입력 (INVALID_*), 잘못된 상태 (EMPTY_CART)
 * - 404: 참조 대상 없음 또는 소유자 불일치 (*_NOT_FOUND)
 * - 500: 저장소 오류 (DATABASE_ERROR, INTERNAL_SERVER_ERROR)
 */
public enum ErrorCode {

    // ========== Invalid Argument (400) ==========

    INVALID_REQUEST("INVALID_REQUEST", "잘못된 요청입니다", 400),
    INVALID_CUSTOMER_ID("INVALID_CUSTOMER_ID", "유효하지 않은 사용자 ID입니다", 400),
    INVALID_ITEM_TYPE("INVALID_ITEM_TYPE", "상품 유형은 room 또는 product 여야 합니다", 400),
    INVALID_QUANTITY("INVALID_QUANTITY", "수량은 1 이상 1000 이하여야 합니다", 400),
    INVALID_STAY_RANGE("INVALID_STAY_RANGE", "유효하지 않은 숙박 기간입니다", 400),
    INVALID_ORDER_STATUS("INVALID_ORDER_STATUS",
            "유효하지 않은 주문 상태입니다. pending, confirmed, cancelled, completed 중 하나여야 합니다", 400),
    DUPLICATE_ROOM_NUMBER("DUPLICATE_ROOM_NUMBER", "이미 존재하는 객실 번호입니다", 400),

    // ========== Invalid State (400) ==========

    EMPTY_CART("EMPTY_CART", "장바구니가 비어 있습니다", 400),
    INVALID_ORDER_TRANSITION("INVALID_ORDER_TRANSITION", "취소된 주문의 상태는 변경할 수 없습니다", 400),

    // ========== Not Found (404) ==========

    ROOM_NOT_FOUND("ROOM_NOT_FOUND", "객실을 찾을 수 없습니다", 404),
    PRODUCT_NOT_FOUND("PRODUCT_NOT_FOUND", "상품을 찾을 수 없습니다", 404),
    ITEM_NOT_FOUND("ITEM_NOT_FOUND", "상품을 찾을 수 없습니다", 404),
    CART_ITEM_NOT_FOUND("CART_ITEM_NOT_FOUND", "장바구니 항목을 찾을 수 없습니다", 404),
    ORDER_NOT_FOUND("ORDER_NOT_FOUND", "주문을 찾을 수 없습니다", 404),

    // ========== System Errors (500) ==========

    ORDER_CREATION_FAILED("ORDER_CREATION_FAILED", "주문 생성에 실패했습니다", 500),
    DATABASE_ERROR("DATABASE_ERROR", "데이터베이스 오류가 발생했습니다", 500),
    INTERNAL_SERVER_ERROR("INTERNAL_SERVER_ERROR", "서버 오류가 발생했습니다", 500);

    private final String code;
    private final String message;
    private final int statusCode;

    ErrorCode(String code, String message, int statusCode) {
        this.code = code;
        this.message = message;
        this.statusCode = statusCode;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
