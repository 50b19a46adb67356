package com.hhplus.hotel.application.admin.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AddRoomCommand {
    private String roomNumber;
    private String roomType;
    private String title;
    private String description;
    private BigDecimal pricePerNight;
    private Integer maxOccupancy;
    private List<String> amenities;
    private List<String> images;
}
