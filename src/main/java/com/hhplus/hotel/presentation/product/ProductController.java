package com.hhplus.hotel.presentation.product;

import com.hhplus.hotel.application.product.ProductService;
import com.hhplus.hotel.presentation.product.response.CategoryListResponse;
import com.hhplus.hotel.presentation.product.response.ProductListResponse;
import com.hhplus.hotel.presentation.product.response.ProductResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * ProductController - Presentation 계층
 * 상품 조회 API
 */
@RestController
@RequestMapping("/products")
public class ProductController {

    private final ProductService productService;

    public ProductController(ProductService productService) {
        this.productService = productService;
    }

    /**
     * GET /products?category= - 판매 중 상품 목록
     */
    @GetMapping
    public ResponseEntity<ProductListResponse> getProducts(
            @RequestParam(value = "category", required = false) String category) {
        return ResponseEntity.ok(ProductListResponse.from(productService.getProducts(category), category));
    }

    /**
     * GET /products/categories - 카테고리별 상품 수
     */
    @GetMapping("/categories")
    public ResponseEntity<CategoryListResponse> getCategories() {
        return ResponseEntity.ok(CategoryListResponse.from(productService.getCategories()));
    }

    /**
     * GET /products/{id} - 상품 상세
     */
    @GetMapping("/{id}")
    public ResponseEntity<ProductResponse> getProduct(@PathVariable("id") Long productId) {
        return ResponseEntity.ok(ProductResponse.from(productService.getProduct(productId)));
    }
}
