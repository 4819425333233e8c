package com.example.geminibot.controller.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * 헬스 체크 응답 DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthResponse {
    private String status; // healthy / unhealthy
    private Instant timestamp;
    private Map<String, String> services; // 구성 요소별 상태
}
