package com.hhplus.hotel.presentation.cart.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * 장바구니 항목 추가 요청 DTO
 *
 * 날짜는 객실 항목에만 사용된다 (yyyy-MM-dd).
 * 수량 범위는 도메인에서 검증한다 (INVALID_QUANTITY).
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AddCartItemRequest {

    @NotBlank(message = "item_type은 필수입니다")
    @JsonProperty("item_type")
    private String itemType;

    @NotNull(message = "item_id는 필수입니다")
    @JsonProperty("item_id")
    private Long itemId;

    @NotNull(message = "quantity는 필수입니다")
    @JsonProperty("quantity")
    private Integer quantity;

    @JsonProperty("check_in_date")
    private LocalDate checkInDate;

    @JsonProperty("check_out_date")
    private LocalDate checkOutDate;
}
