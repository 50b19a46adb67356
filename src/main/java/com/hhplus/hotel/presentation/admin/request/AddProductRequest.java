package com.hhplus.hotel.presentation.admin.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AddProductRequest {

    @NotBlank(message = "name은 필수입니다")
    @JsonProperty("name")
    private String name;

    @JsonProperty("description")
    private String description;

    @NotNull(message = "price는 필수입니다")
    @DecimalMin(value = "0.00", message = "price는 0 이상이어야 합니다")
    @JsonProperty("price")
    private BigDecimal price;

    @NotBlank(message = "category는 필수입니다")
    @JsonProperty("category")
    private String category;

    @Min(value = 0, message = "stock_quantity는 0 이상이어야 합니다")
    @JsonProperty("stock_quantity")
    private Integer stockQuantity;

    @JsonProperty("images")
    private List<String> images;
}
