package com.hhplus.hotel.common.exception;

/**
 * DomainException - 도메인 규칙 위반 예외
 *
 * 역할:
 * - 유효성 검증 실패, 참조 대상 없음, 잘못된 상태 등
 * - 일반적으로 클라이언트 오류(4XX)로 응답
 *
 * 사용 예:
 * - RoomNotFoundException: 객실 조회 실패
 * - EmptyCartException: 빈 장바구니 주문
 * - InvalidOrderStatusException: 잘못된 주문 상태
 */
public class DomainException extends BizException {

    public DomainException(ErrorCode errorCode) {
        super(errorCode);
    }

    public DomainException(ErrorCode errorCode, Throwable cause) {
        super(errorCode, cause);
    }

    public DomainException(ErrorCode errorCode, String detailMessage) {
        super(errorCode, detailMessage);
    }
}
