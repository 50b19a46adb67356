package com.hhplus.hotel.domain.order;

import com.hhplus.hotel.common.exception.DomainException;
import com.hhplus.hotel.common.exception.ErrorCode;
import lombok.Getter;

import java.util.Locale;

/**
 * OrderStatus - 주문 상태
 *
 * - PENDING: 주문 생성됨 (체크아웃 직후)
 * - CONFIRMED: 관리자 확인 완료
 * - COMPLETED: 이용/배송 완료
 * - CANCELLED: 취소됨 (종료 상태, 객실 예약도 함께 취소)
 *
 * 상태 전환 규칙:
 * - CANCELLED를 제외한 상태 사이는 자유롭게 변경 가능
 * - CANCELLED에서 다른 상태로는 변경 불가
 */
@Getter
public enum OrderStatus {
    PENDING("주문 대기"),
    CONFIRMED("주문 확인"),
    CANCELLED("주문 취소"),
    COMPLETED("주문 완료");

    private final String displayName;

    OrderStatus(String displayName) {
        this.displayName = displayName;
    }

    /**
     * 응답/알림용 소문자 코드
     */
    public String getCode() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * 문자열에서 OrderStatus로 변환 (대소문자 무시)
     *
     * @throws DomainException INVALID_ORDER_STATUS
     */
    public static OrderStatus fromString(String status) {
        if (status == null || status.isBlank()) {
            throw new DomainException(ErrorCode.INVALID_ORDER_STATUS, "입력값: " + status);
        }
        try {
            return OrderStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new DomainException(ErrorCode.INVALID_ORDER_STATUS, "입력값: " + status);
        }
    }
}
