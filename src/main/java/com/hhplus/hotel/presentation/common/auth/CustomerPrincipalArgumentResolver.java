package com.hhplus.hotel.presentation.common.auth;

import com.hhplus.hotel.common.auth.CustomerPrincipal;
import com.hhplus.hotel.common.exception.DomainException;
import com.hhplus.hotel.common.exception.ErrorCode;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * X-USER-ID 헤더 → CustomerPrincipal
 *
 * 인증은 이 서비스의 범위가 아니므로 헤더 값을 그대로 신뢰한다.
 */
public class CustomerPrincipalArgumentResolver implements HandlerMethodArgumentResolver {

    public static final String USER_ID_HEADER = "X-USER-ID";

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return parameter.hasParameterAnnotation(CurrentCustomer.class)
                && CustomerPrincipal.class.isAssignableFrom(parameter.getParameterType());
    }

    @Override
    public CustomerPrincipal resolveArgument(MethodParameter parameter, ModelAndViewContainer mavContainer,
                                             NativeWebRequest webRequest, WebDataBinderFactory binderFactory) {
        String header = webRequest.getHeader(USER_ID_HEADER);
        if (header == null || header.isBlank()) {
            throw new DomainException(ErrorCode.INVALID_CUSTOMER_ID, USER_ID_HEADER + " 헤더가 없습니다");
        }
        try {
            return CustomerPrincipal.of(Long.parseLong(header.trim()));
        } catch (IllegalArgumentException e) {
            throw new DomainException(ErrorCode.INVALID_CUSTOMER_ID, USER_ID_HEADER + "=" + header);
        }
    }
}
