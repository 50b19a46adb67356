package com.hhplus.hotel.application.product;

import com.hhplus.hotel.domain.product.CategorySummary;
import com.hhplus.hotel.domain.product.Product;
import com.hhplus.hotel.domain.product.ProductNotFoundException;
import com.hhplus.hotel.domain.product.ProductRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * ProductService - 상품 조회 Application 서비스
 *
 * 판매 중(isActive) 상품만 노출한다.
 */
@Service
@Transactional(readOnly = true)
public class ProductService {

    private final ProductRepository productRepository;

    public ProductService(ProductRepository productRepository) {
        this.productRepository = productRepository;
    }

    /**
     * 상품 목록
     *
     * @param category null 또는 공백이면 전체 (카테고리, 이름 순), 아니면 해당 카테고리 (이름 순)
     */
    public List<Product> getProducts(String category) {
        if (category == null || category.isBlank()) {
            return productRepository.findActiveOrderByCategoryAndName();
        }
        return productRepository.findActiveByCategory(category.trim());
    }

    public Product getProduct(Long productId) {
        return productRepository.findActiveById(productId)
                .orElseThrow(() -> new ProductNotFoundException(productId));
    }

    public List<CategorySummary> getCategories() {
        return productRepository.findActiveCategories();
    }
}
