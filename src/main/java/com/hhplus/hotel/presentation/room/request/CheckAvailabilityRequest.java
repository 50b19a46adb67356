package com.hhplus.hotel.presentation.room.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * 객실 예약 가능 여부 조회 요청 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckAvailabilityRequest {

    @NotNull(message = "room_id는 필수입니다")
    @JsonProperty("room_id")
    private Long roomId;

    @NotNull(message = "check_in_date는 필수입니다")
    @JsonProperty("check_in_date")
    private LocalDate checkInDate;

    @NotNull(message = "check_out_date는 필수입니다")
    @JsonProperty("check_out_date")
    private LocalDate checkOutDate;
}
