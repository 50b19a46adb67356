package com.hhplus.hotel.presentation.order.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 주문 생성 요청 DTO
 * 주문 항목은 장바구니에서 읽으므로 연락처 정보만 받는다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateOrderRequest {

    @NotBlank(message = "customer_name은 필수입니다")
    @Size(max = 255, message = "customer_name은 255자 이하여야 합니다")
    @JsonProperty("customer_name")
    private String customerName;

    @NotBlank(message = "customer_phone은 필수입니다")
    @Size(max = 50, message = "customer_phone은 50자 이하여야 합니다")
    @JsonProperty("customer_phone")
    private String customerPhone;

    @Email(message = "customer_email 형식이 올바르지 않습니다")
    @JsonProperty("customer_email")
    private String customerEmail;

    @JsonProperty("notes")
    private String notes;
}
