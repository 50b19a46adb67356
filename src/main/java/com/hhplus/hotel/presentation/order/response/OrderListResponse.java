package com.hhplus.hotel.presentation.order.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.hotel.domain.order.Order;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.stream.Collectors;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class OrderListResponse {

    @JsonProperty("orders")
    private List<OrderResponse> orders;

    @JsonProperty("count")
    private int count;

    public static OrderListResponse from(List<Order> orders) {
        List<OrderResponse> responses = orders.stream()
                .map(OrderResponse::withItems)
                .collect(Collectors.toList());
        return new OrderListResponse(responses, responses.size());
    }
}
