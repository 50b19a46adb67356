package com.hhplus.hotel.infrastructure.persistence.product;

import com.hhplus.hotel.domain.product.CategorySummary;
import com.hhplus.hotel.domain.product.Product;
import com.hhplus.hotel.domain.product.ProductRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * MySQL 기반 Product Repository 구현
 * Spring Data JPA를 사용한 영구 저장소
 */
@Repository
public class MySQLProductRepository implements ProductRepository {

    private final ProductJpaRepository productJpaRepository;

    public MySQLProductRepository(ProductJpaRepository productJpaRepository) {
        this.productJpaRepository = productJpaRepository;
    }

    @Override
    public List<Product> findActiveOrderByCategoryAndName() {
        return productJpaRepository.findByIsActiveTrueOrderByCategoryAscNameAsc();
    }

    @Override
    public List<Product> findActiveByCategory(String category) {
        return productJpaRepository.findByIsActiveTrueAndCategoryOrderByNameAsc(category);
    }

    @Override
    public Optional<Product> findActiveById(Long productId) {
        return productJpaRepository.findByProductIdAndIsActiveTrue(productId);
    }

    @Override
    public List<Product> findAllByIds(Collection<Long> productIds) {
        if (productIds.isEmpty()) {
            return List.of();
        }
        return productJpaRepository.findAllById(productIds);
    }

    @Override
    public List<CategorySummary> findActiveCategories() {
        return productJpaRepository.findActiveCategorySummaries();
    }

    @Override
    public Product save(Product product) {
        return productJpaRepository.save(product);
    }
}
