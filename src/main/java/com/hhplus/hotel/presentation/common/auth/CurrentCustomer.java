package com.hhplus.hotel.presentation.common.auth;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 컨트롤러 파라미터에 요청 사용자(CustomerPrincipal)를 주입한다.
 * X-USER-ID 헤더가 없거나 양의 정수가 아니면 400 (INVALID_CUSTOMER_ID).
 */
@Target(ElementType.PARAMETER)
@Retention(RetentionPolicy.RUNTIME)
public @interface CurrentCustomer {
}
