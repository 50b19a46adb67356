package com.hhplus.hotel.presentation.room.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.hhplus.hotel.domain.room.Room;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.stream.Collectors;

@Getter
@NoArgsConstructor
@AllArgsConstructor
public class RoomListResponse {

    @JsonProperty("rooms")
    private List<RoomResponse> rooms;

    @JsonProperty("count")
    private int count;

    public static RoomListResponse from(List<Room> rooms) {
        List<RoomResponse> responses = rooms.stream()
                .map(RoomResponse::from)
                .collect(Collectors.toList());
        return new RoomListResponse(responses, responses.size());
    }
}
