package com.hhplus.hotel.presentation.admin.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * 객실 등록 요청 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AddRoomRequest {

    @NotBlank(message = "room_number는 필수입니다")
    @JsonProperty("room_number")
    private String roomNumber;

    @NotBlank(message = "room_type은 필수입니다")
    @JsonProperty("room_type")
    private String roomType;

    @NotBlank(message = "title은 필수입니다")
    @JsonProperty("title")
    private String title;

    @JsonProperty("description")
    private String description;

    @NotNull(message = "price_per_night는 필수입니다")
    @DecimalMin(value = "0.00", message = "price_per_night는 0 이상이어야 합니다")
    @JsonProperty("price_per_night")
    private BigDecimal pricePerNight;

    @Min(value = 1, message = "max_occupancy는 1 이상이어야 합니다")
    @JsonProperty("max_occupancy")
    private Integer maxOccupancy;

    @JsonProperty("amenities")
    private List<String> amenities;

    @JsonProperty("images")
    private List<String> images;
}
