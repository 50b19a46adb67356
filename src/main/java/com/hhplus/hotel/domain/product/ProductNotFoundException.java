package com.hhplus.hotel.domain.product;

import com.hhplus.hotel.common.exception.DomainException;
import com.hhplus.hotel.common.exception.ErrorCode;

/**
 * 상품을 찾을 수 없을 때 발생하는 예외
 * 비활성 상품도 외부에는 존재하지 않는 상품으로 취급한다.
 */
public class ProductNotFoundException extends DomainException {

    public ProductNotFoundException(Long productId) {
        super(ErrorCode.PRODUCT_NOT_FOUND, "Product ID: " + productId);
    }
}
