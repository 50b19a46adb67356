package com.hhplus.hotel.presentation.cart.response;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.hotel.domain.cart.PricedCartLine;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 장바구니 항목 응답 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CartItemResponse {

    @JsonProperty("id")
    private Long id;

    @JsonProperty("item_type")
    private String itemType;

    @JsonProperty("item_id")
    private Long itemId;

    @JsonProperty("item_name")
    private String itemName;

    @JsonProperty("quantity")
    private Integer quantity;

    @JsonProperty("unit_price")
    private BigDecimal unitPrice;

    @JsonProperty("check_in_date")
    private LocalDate checkInDate;

    @JsonProperty("check_out_date")
    private LocalDate checkOutDate;

    @JsonProperty("nights")
    private Integer nights;

    @JsonProperty("total_price")
    private BigDecimal totalPrice;

    @JsonProperty("images")
    private List<String> images;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    @JsonProperty("created_at")
    private LocalDateTime createdAt;

    public static CartItemResponse from(PricedCartLine line) {
        return CartItemResponse.builder()
                .id(line.getCartItemId())
                .itemType(line.getItemType().getCode())
                .itemId(line.getItemId())
                .itemName(line.getItemName())
                .quantity(line.getQuantity())
                .unitPrice(line.getUnitPrice())
                .checkInDate(line.getStayRange() != null ? line.getStayRange().getCheckIn() : null)
                .checkOutDate(line.getStayRange() != null ? line.getStayRange().getCheckOut() : null)
                .nights(line.getNights())
                .totalPrice(line.getLineTotal())
                .images(line.getImages())
                .createdAt(line.getCreatedAt())
                .build();
    }
}
