package com.hhplus.hotel.presentation.common.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * 메시지만 담는 응답 (삭제 등)
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class MessageResponse {
    @JsonProperty("message")
    private String message;
}
