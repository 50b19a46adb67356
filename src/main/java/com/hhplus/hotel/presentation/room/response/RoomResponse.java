package com.hhplus.hotel.presentation.room.response;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.hotel.domain.room.Room;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * 객실 응답 DTO
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RoomResponse {

    @JsonProperty("id")
    private Long id;

    @JsonProperty("room_number")
    private String roomNumber;

    @JsonProperty("room_type")
    private String roomType;

    @JsonProperty("title")
    private String title;

    @JsonProperty("description")
    private String description;

    @JsonProperty("price_per_night")
    private BigDecimal pricePerNight;

    @JsonProperty("max_occupancy")
    private Integer maxOccupancy;

    @JsonProperty("amenities")
    private List<String> amenities;

    @JsonProperty("images")
    private List<String> images;

    @JsonProperty("is_available")
    private Boolean isAvailable;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    @JsonProperty("created_at")
    private LocalDateTime createdAt;

    @JsonFormat(pattern = "yyyy-MM-dd'T'HH:mm:ss")
    @JsonProperty("updated_at")
    private LocalDateTime updatedAt;

    public static RoomResponse from(Room room) {
        return RoomResponse.builder()
                .id(room.getRoomId())
                .roomNumber(room.getRoomNumber())
                .roomType(room.getRoomType())
                .title(room.getTitle())
                .description(room.getDescription())
                .pricePerNight(room.getPricePerNight())
                .maxOccupancy(room.getMaxOccupancy())
                .amenities(room.getAmenities() != null ? room.getAmenities() : List.of())
                .images(room.getImages() != null ? room.getImages() : List.of())
                .isAvailable(room.getIsAvailable())
                .createdAt(room.getCreatedAt())
                .updatedAt(room.getUpdatedAt())
                .build();
    }
}
