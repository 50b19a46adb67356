package com.hhplus.hotel.domain.cart;

import com.hhplus.hotel.common.exception.DomainException;
import com.hhplus.hotel.common.exception.ErrorCode;
import com.hhplus.hotel.domain.common.ItemType;

/**
 * 장바구니 항목이 가리키는 객실/상품이 없거나 판매 중이 아닐 때 발생하는 예외
 */
public class CatalogItemNotFoundException extends DomainException {

    public CatalogItemNotFoundException(ItemType itemType, Long itemId) {
        super(ErrorCode.ITEM_NOT_FOUND, itemType.getCode() + " ID: " + itemId);
    }
}
