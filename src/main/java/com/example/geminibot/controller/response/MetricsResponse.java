package com.example.geminibot.controller.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 모니터링용 평면 지표 응답 DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MetricsResponse {
    @JsonProperty("uptime_seconds")
    private long uptimeSeconds;
    @JsonProperty("messages_processed")
    private long messagesProcessed;
    @JsonProperty("images_analyzed")
    private long imagesAnalyzed;
    @JsonProperty("images_generated")
    private long imagesGenerated;
    private long errors;
    @JsonProperty("active_users")
    private int activeUsers;
    @JsonProperty("context_size_total")
    private int contextSizeTotal; // 전체 사용자의 보관 턴 수 합계
}
