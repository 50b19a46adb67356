package com.hhplus.hotel.presentation.product.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.hotel.domain.product.CategorySummary;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.stream.Collectors;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class CategoryListResponse {

    @JsonProperty("categories")
    private List<CategoryView> categories;

    @JsonProperty("count")
    private int count;

    public static CategoryListResponse from(List<CategorySummary> summaries) {
        List<CategoryView> views = summaries.stream()
                .map(summary -> new CategoryView(summary.getCategory(), summary.getProductCount()))
                .collect(Collectors.toList());
        return new CategoryListResponse(views, views.size());
    }

    @Getter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CategoryView {
        @JsonProperty("category")
        private String category;

        @JsonProperty("product_count")
        private long productCount;
    }
}
