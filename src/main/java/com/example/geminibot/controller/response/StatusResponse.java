package com.example.geminibot.controller.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * 봇 상태 조회 응답 DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatusResponse {
    private String status; // 항상 "online"
    @JsonProperty("uptime_seconds")
    private long uptimeSeconds;
    @JsonProperty("uptime_formatted")
    private String uptimeFormatted; // "1d 2h 3m"
    @JsonProperty("bot_info")
    private Map<String, Object> botInfo;
    private Statistics statistics;
    private Instant timestamp;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Statistics {
        @JsonProperty("messages_processed")
        private long messagesProcessed;
        @JsonProperty("images_analyzed")
        private long imagesAnalyzed;
        @JsonProperty("images_generated")
        private long imagesGenerated;
        private long errors;
        @JsonProperty("active_users")
        private int activeUsers;
    }
}
