package com.hhplus.hotel.presentation.admin.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.hotel.presentation.order.response.OrderResponse;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 관리자 주문 목록 응답 DTO
 * count는 현재 페이지 건수, total_count는 필터 기준 전체 건수
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdminOrderListResponse {

    @JsonProperty("orders")
    private List<OrderResponse> orders;

    @JsonProperty("count")
    private int count;

    @JsonProperty("total_count")
    private long totalCount;

    @JsonProperty("status")
    private String status;
}
