package com.hhplus.hotel.presentation.health;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * GET /health - 생존 확인
 */
@RestController
public class HealthController {

    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(new HealthResponse("ok", "Hotel store API is running"));
    }

    @Getter
    @AllArgsConstructor
    public static class HealthResponse {
        @JsonProperty("status")
        private final String status;

        @JsonProperty("message")
        private final String message;
    }
}
