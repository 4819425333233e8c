package com.example.geminibot.controller.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatsSummaryResponse {
    private boolean online;
    @JsonProperty("uptime_hours")
    private double uptimeHours; // 소수점 둘째 자리까지
    @JsonProperty("total_messages")
    private long totalMessages;
    @JsonProperty("total_images_processed")
    private long totalImagesProcessed;
    @JsonProperty("active_users")
    private int activeUsers;
    @JsonProperty("error_rate")
    private double errorRate; // 퍼센트
    @JsonProperty("last_updated")
    private Instant lastUpdated;
}
