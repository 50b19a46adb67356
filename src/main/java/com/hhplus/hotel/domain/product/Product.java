package com.hhplus.hotel.domain.product;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Product 도메인 엔티티
 *
 * 책임:
 * - 판매 상품 (기념품, 식품, 서비스 등) 정보 관리
 * - 판매 여부 (isActive) 관리
 *
 * 핵심 비즈니스 규칙:
 * - 가격은 0보다 커야 함
 * - 재고 수량은 0 이상 (정보성 필드, 주문 시 차감하지 않음)
 * - 비활성 상품은 조회/장바구니 추가 대상이 아님
 */
@Entity
@Table(name = "products")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Product {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long productId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Column(name = "price", nullable = false, precision = 10, scale = 2)
    private BigDecimal price;

    @Column(name = "category", nullable = false, length = 100)
    private String category;

    @Column(name = "stock_quantity", nullable = false)
    private Integer stockQuantity;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "images")
    @Builder.Default
    private List<String> images = new ArrayList<>();

    @Column(name = "is_active", nullable = false)
    private Boolean isActive;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /**
     * 상품 생성 팩토리 메서드
     *
     * 비즈니스 규칙:
     * - 상품명, 카테고리는 필수
     * - 가격은 0보다 커야 함
     * - 재고 미지정 시 0
     * - 생성 직후 판매 상태
     */
    public static Product createProduct(String name, String description, BigDecimal price,
                                        String category, Integer stockQuantity, List<String> images) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("상품명은 필수입니다");
        }
        if (category == null || category.isBlank()) {
            throw new IllegalArgumentException("카테고리는 필수입니다");
        }
        if (price == null || price.signum() <= 0) {
            throw new IllegalArgumentException("가격은 0보다 커야 합니다");
        }
        if (stockQuantity != null && stockQuantity < 0) {
            throw new IllegalArgumentException("재고 수량은 음수가 될 수 없습니다");
        }

        LocalDateTime now = LocalDateTime.now();
        return Product.builder()
                .name(name)
                .description(description)
                .price(price.setScale(2, RoundingMode.HALF_UP))
                .category(category)
                .stockQuantity(stockQuantity != null ? stockQuantity : 0)
                .images(images != null ? new ArrayList<>(images) : new ArrayList<>())
                .isActive(true)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * 판매 중인 상품인지 확인
     */
    public boolean isPurchasable() {
        return Boolean.TRUE.equals(this.isActive);
    }
}
