package com.hhplus.hotel.domain.common;

import com.hhplus.hotel.common.exception.DomainException;
import com.hhplus.hotel.common.exception.ErrorCode;
import com.hhplus.hotel.domain.common.vo.StayRange;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * ItemType - 장바구니/주문 항목 유형
 *
 * 항목은 객실(ROOM) 또는 상품(PRODUCT) 중 하나이며,
 * 유형별 가격 계산 규칙을 각 상수가 직접 구현한다.
 *
 * 가격 규칙:
 * - ROOM: 1박 요금 × 숙박일 수 × 수량 (숙박 기간이 없으면 1박)
 * - PRODUCT: 단가 × 수량 (숙박 기간 무시)
 */
public enum ItemType {

    ROOM("room") {
        @Override
        public Integer nights(StayRange stayRange) {
            return stayRange == null ? StayRange.MIN_NIGHTS : stayRange.nights();
        }

        @Override
        public boolean createsBooking(StayRange stayRange) {
            return stayRange != null;
        }
    },

    PRODUCT("product") {
        @Override
        public Integer nights(StayRange stayRange) {
            return null;
        }

        @Override
        public boolean createsBooking(StayRange stayRange) {
            return false;
        }
    };

    /** 금액 소수점 자릿수 (DECIMAL(10,2)) */
    public static final int AMOUNT_SCALE = 2;

    private final String code;

    ItemType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * 과금 숙박일 수. 객실은 최소 1박, 숙박 기간이 적용되지 않는 항목은 null
     */
    public abstract Integer nights(StayRange stayRange);

    /**
     * 주문 시 객실 예약(RoomBooking)을 생성해야 하는지 여부
     */
    public abstract boolean createsBooking(StayRange stayRange);

    /**
     * 항목 합계 계산
     *
     * @param unitPrice 단가 (객실은 1박 요금)
     * @param quantity 수량
     * @param stayRange 숙박 기간 (nullable)
     * @return 단가 × (숙박일 수) × 수량
     */
    public BigDecimal lineTotal(BigDecimal unitPrice, int quantity, StayRange stayRange) {
        Integer nights = nights(stayRange);
        BigDecimal total = unitPrice.multiply(BigDecimal.valueOf(quantity));
        if (nights != null) {
            total = total.multiply(BigDecimal.valueOf(nights));
        }
        return total.setScale(AMOUNT_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * 요청 문자열("room", "product")에서 ItemType으로 변환 (대소문자 무시)
     *
     * @throws DomainException INVALID_ITEM_TYPE
     */
    public static ItemType from(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (ItemType type : values()) {
                if (type.code.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new DomainException(ErrorCode.INVALID_ITEM_TYPE, "입력값: " + value);
    }
}
