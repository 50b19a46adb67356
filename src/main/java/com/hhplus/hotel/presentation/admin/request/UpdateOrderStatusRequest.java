package com.hhplus.hotel.presentation.admin.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 관리자 주문 상태 변경 요청 DTO
 * status 값 검증은 OrderStatus.fromString에서 수행한다.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateOrderStatusRequest {

    @NotBlank(message = "status는 필수입니다")
    @JsonProperty("status")
    private String status;

    @JsonProperty("notes")
    private String notes;
}
