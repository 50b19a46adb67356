package com.hhplus.hotel.domain.product;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Product Repository Interface (Domain Layer - Port)
 * 상품 데이터 접근 인터페이스
 * 의존성 역전: 구현체는 이 인터페이스에 의존한다.
 */
public interface ProductRepository {

    /**
     * 판매 중 상품 전체 (카테고리, 이름 순)
     */
    List<Product> findActiveOrderByCategoryAndName();

    /**
     * 카테고리별 판매 중 상품 (이름 순)
     */
    List<Product> findActiveByCategory(String category);

    /**
     * 판매 중 상품 단건 조회
     */
    Optional<Product> findActiveById(Long productId);

    /**
     * 여러 상품 일괄 조회 (판매 여부 무관)
     */
    List<Product> findAllByIds(Collection<Long> productIds);

    /**
     * 판매 중 상품의 카테고리별 개수
     */
    List<CategorySummary> findActiveCategories();

    Product save(Product product);
}
