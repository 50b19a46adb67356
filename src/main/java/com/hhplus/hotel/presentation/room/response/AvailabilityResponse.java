package com.hhplus.hotel.presentation.room.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.hotel.application.room.dto.AvailabilityResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * 객실 예약 가능 여부 응답 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AvailabilityResponse {

    @JsonProperty("available")
    private boolean available;

    @JsonProperty("room_id")
    private Long roomId;

    @JsonProperty("check_in_date")
    private LocalDate checkInDate;

    @JsonProperty("check_out_date")
    private LocalDate checkOutDate;

    @JsonProperty("conflicting_bookings")
    private long conflictingBookings;

    public static AvailabilityResponse from(AvailabilityResult result) {
        return AvailabilityResponse.builder()
                .available(result.isAvailable())
                .roomId(result.getRoomId())
                .checkInDate(result.getStayRange().getCheckIn())
                .checkOutDate(result.getStayRange().getCheckOut())
                .conflictingBookings(result.getConflictingBookings())
                .build();
    }
}
