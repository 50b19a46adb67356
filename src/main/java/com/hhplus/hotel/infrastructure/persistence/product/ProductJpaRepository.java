package com.hhplus.hotel.infrastructure.persistence.product;

import com.hhplus.hotel.domain.product.CategorySummary;
import com.hhplus.hotel.domain.product.Product;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;
import java.util.Optional;

/**
 * Product JPA Repository
 * Spring Data JPA를 통한 Product 엔티티 영구 저장소
 */
public interface ProductJpaRepository extends JpaRepository<Product, Long> {

    List<Product> findByIsActiveTrueOrderByCategoryAscNameAsc();

    List<Product> findByIsActiveTrueAndCategoryOrderByNameAsc(String category);

    Optional<Product> findByProductIdAndIsActiveTrue(Long productId);

    /**
     * 판매 중 상품의 카테고리별 개수 (카테고리 순)
     */
    @Query("SELECT new com.hhplus.hotel.domain.product.CategorySummary(p.category, COUNT(p)) " +
           "FROM Product p " +
           "WHERE p.isActive = true " +
           "GROUP BY p.category " +
           "ORDER BY p.category")
    List<CategorySummary> findActiveCategorySummaries();
}
