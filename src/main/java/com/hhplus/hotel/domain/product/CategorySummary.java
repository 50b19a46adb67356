package com.hhplus.hotel.domain.product;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 카테고리별 판매 중 상품 수 (조회 전용 projection)
 */
@Getter
@AllArgsConstructor
public class CategorySummary {
    private final String category;
    private final long productCount;
}
