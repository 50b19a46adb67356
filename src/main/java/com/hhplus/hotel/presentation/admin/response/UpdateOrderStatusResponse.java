package com.hhplus.hotel.presentation.admin.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class UpdateOrderStatusResponse {

    @JsonProperty("message")
    private String message;

    @JsonProperty("order_id")
    private Long orderId;

    @JsonProperty("status")
    private String status;
}
