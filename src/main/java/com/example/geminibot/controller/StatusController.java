package com.example.geminibot.controller;

import com.example.geminibot.config.BotProperties;
import com.example.geminibot.controller.response.ErrorResponse;
import com.example.geminibot.controller.response.HealthResponse;
import com.example.geminibot.controller.response.MetricsResponse;
import com.example.geminibot.controller.response.StatsSummaryResponse;
import com.example.geminibot.controller.response.StatusResponse;
import com.example.geminibot.coordinator.StateCoordinator;
import com.example.geminibot.coordinator.StatusSnapshot;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 봇 상태 조회 API
 * 모든 값은 {@link StateCoordinator} 스냅샷에서 읽는다.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class StatusController {

    static final String API_VERSION = "1.0.0";
    static final List<String> ENDPOINTS = List.of("/status", "/health", "/webhook", "/metrics",
            "/api/info", "/api/stats/summary");

    private final StateCoordinator coordinator;
    private final BotProperties properties;

    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        if (!coordinator.isAvailable()) {
            log.warn("Health check failed - state coordinator did not respond in time");
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(HealthResponse.builder()
                            .status("unhealthy")
                            .timestamp(Instant.now())
                            .build());
        }

        Map<String, String> services = new LinkedHashMap<>();
        services.put("bot", "running");
        services.put("gemini_api", isBlank(properties.getGemini().getApiKey()) ? "missing" : "configured");
        services.put("telegram_api", isBlank(properties.getTelegram().getToken()) ? "missing" : "configured");

        return ResponseEntity.ok(HealthResponse.builder()
                .status("healthy")
                .timestamp(Instant.now())
                .services(services)
                .build());
    }

    @GetMapping("/status")
    @RateLimiter(name = "statusApi", fallbackMethod = "tooManyRequests")
    public ResponseEntity<?> status() {
        StatusSnapshot snapshot = coordinator.statusSnapshot();

        return ResponseEntity.ok(StatusResponse.builder()
                .status("online")
                .uptimeSeconds(snapshot.getUptimeSeconds())
                .uptimeFormatted(snapshot.getUptimeFormatted())
                .botInfo(properties.getBotInfo())
                .statistics(StatusResponse.Statistics.builder()
                        .messagesProcessed(snapshot.getMessagesProcessed())
                        .imagesAnalyzed(snapshot.getImagesAnalyzed())
                        .imagesGenerated(snapshot.getImagesGenerated())
                        .errors(snapshot.getErrors())
                        .activeUsers(snapshot.getActiveUsers())
                        .build())
                .timestamp(snapshot.getTimestamp())
                .build());
    }

    @GetMapping("/metrics")
    @RateLimiter(name = "statusApi", fallbackMethod = "tooManyRequests")
    public ResponseEntity<?> metrics() {
        StatusSnapshot snapshot = coordinator.statusSnapshot();

        return ResponseEntity.ok(MetricsResponse.builder()
                .uptimeSeconds(snapshot.getUptimeSeconds())
                .messagesProcessed(snapshot.getMessagesProcessed())
                .imagesAnalyzed(snapshot.getImagesAnalyzed())
                .imagesGenerated(snapshot.getImagesGenerated())
                .errors(snapshot.getErrors())
                .activeUsers(snapshot.getActiveUsers())
                .contextSizeTotal(snapshot.getContextSizeTotal())
                .build());
    }

    @GetMapping("/api/stats/summary")
    @RateLimiter(name = "statusApi", fallbackMethod = "tooManyRequests")
    public ResponseEntity<?> statsSummary() {
        StatusSnapshot snapshot = coordinator.statusSnapshot();

        return ResponseEntity.ok(StatsSummaryResponse.builder()
                .online(true)
                .uptimeHours(round2(snapshot.getUptimeSeconds() / 3600.0))
                .totalMessages(snapshot.getMessagesProcessed())
                .totalImagesProcessed(snapshot.getTotalImagesProcessed())
                .activeUsers(snapshot.getActiveUsers())
                .errorRate(round2(snapshot.getErrorRate()))
                .lastUpdated(snapshot.getTimestamp())
                .build());
    }

    @GetMapping("/api/info")
    public Map<String, Object> apiInfo() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("api_version", API_VERSION);
        info.put("bot_name", properties.getBotName());
        info.put("description", "Telegram bot with Gemini AI integration");
        info.put("features", List.of(
                "AI-powered conversations",
                "Image generation with Gemini",
                "Image analysis and recognition",
                "Admin control panel",
                "Real-time status monitoring",
                "Rate limiting"));
        info.put("endpoints", ENDPOINTS);
        info.put("timestamp", Instant.now());
        return info;
    }

    // statusApi 한도 초과 시 실행
    public ResponseEntity<ErrorResponse> tooManyRequests(RequestNotPermitted e) {
        log.warn("Status API rate limit exceeded: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .body(ErrorResponse.builder()
                        .error("Too Many Requests")
                        .message("Status API rate limit exceeded. Please try again later.")
                        .build());
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
