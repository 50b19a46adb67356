package com.hhplus.hotel.presentation.product.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.hotel.domain.product.Product;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.stream.Collectors;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class ProductListResponse {

    @JsonProperty("products")
    private List<ProductResponse> products;

    @JsonProperty("count")
    private int count;

    /** 요청한 카테고리 필터 (없으면 빈 문자열) */
    @JsonProperty("category")
    private String category;

    public static ProductListResponse from(List<Product> products, String category) {
        List<ProductResponse> responses = products.stream()
                .map(ProductResponse::from)
                .collect(Collectors.toList());
        return new ProductListResponse(responses, responses.size(), category != null ? category : "");
    }
}
