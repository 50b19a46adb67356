package com.hhplus.hotel.common.auth;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * CustomerPrincipal - 요청한 사용자 식별자
 *
 * 요청 헤더(X-USER-ID)에서 한 번 해석된 뒤 서비스 메서드에 명시적으로 전달된다.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class CustomerPrincipal {

    private final Long customerId;

    private CustomerPrincipal(Long customerId) {
        this.customerId = customerId;
    }

    /**
     * @throws IllegalArgumentException customerId가 양수가 아닌 경우
     */
    public static CustomerPrincipal of(Long customerId) {
        if (customerId == null || customerId <= 0) {
            throw new IllegalArgumentException("사용자 ID는 양수여야 합니다");
        }
        return new CustomerPrincipal(customerId);
    }
}
