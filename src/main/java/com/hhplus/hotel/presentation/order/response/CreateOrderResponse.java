package com.hhplus.hotel.presentation.order.response;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.hotel.application.order.dto.PlaceOrderResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 주문 생성 응답 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateOrderResponse {

    @JsonProperty("message")
    private String message;

    @JsonProperty("order_id")
    private Long orderId;

    @JsonProperty("order_number")
    private String orderNumber;

    @JsonProperty("total_amount")
    private BigDecimal totalAmount;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    @JsonProperty("created_at")
    private LocalDateTime createdAt;

    public static CreateOrderResponse from(PlaceOrderResult result) {
        return CreateOrderResponse.builder()
                .message("Order created successfully")
                .orderId(result.getOrderId())
                .orderNumber(result.getOrderNumber())
                .totalAmount(result.getTotalAmount())
                .createdAt(result.getCreatedAt())
                .build();
    }
}
