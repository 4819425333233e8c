package com.example.geminibot.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 봇 설정 프로퍼티 (환경 변수는 application.yml 에서 매핑)
 */
@Slf4j
@Data
@Validated
@ConfigurationProperties(prefix = "bot")
public class BotProperties {

    private String botName = "Advanced Gemini AI Bot"; // 상태 페이지에 표시되는 이름
    private String botUsername = "GeminiAIBot"; // 플랫폼상의 봇 계정명
    private long adminId; // 관리자 사용자 ID (0 이면 관리자 없음)
    private String webhookUrl; // 외부에서 접근 가능한 webhook 주소 (선택)

    @Min(1)
    private int maxMessageLength = 4096; // 플랫폼 메시지 최대 길이
    @Min(1)
    private long maxImageSize = 20L * 1024 * 1024; // 분석 가능한 최대 이미지 크기 (20MB)
    private List<String> allowedImageTypes = new ArrayList<>(List.of("image/jpeg", "image/png", "image/webp"));

    @Valid
    private RateLimit rateLimit = new RateLimit();
    @Valid
    private Context context = new Context();
    @Valid
    private Telegram telegram = new Telegram();
    @Valid
    private Gemini gemini = new Gemini();

    @Data
    public static class RateLimit {
        @Min(1)
        private int limit = 10; // 윈도우 내 최대 메시지 수
        @Min(1)
        private long windowSeconds = 60; // 윈도우 크기 (초)
        @NotNull
        private Duration cleanupInterval = Duration.ofMinutes(5); // 비활성 로그 정리 주기
    }

    @Data
    public static class Context {
        @Min(1)
        private int maxTurns = 20; // 사용자당 보관하는 최대 대화 턴 수
        private Duration idleTimeout = Duration.ZERO; // 0 이면 유휴 컨텍스트를 정리하지 않음
    }

    @Data
    public static class Telegram {
        private String token = "";
        private String apiBaseUrl = "https://api.telegram.org";
        private boolean pollingEnabled = false;
        @Min(0)
        private int pollingTimeoutSeconds = 30; // long polling 대기 시간
    }

    @Data
    public static class Gemini {
        private String apiKey = "";
        private String baseUrl = "https://generativelanguage.googleapis.com/v1beta";
        private String textModel = "gemini-2.5-flash";
        private String visionModel = "gemini-2.5-pro";
        private String imageModel = "gemini-2.0-flash-preview-image-generation";
        @Min(1)
        private int contextTurns = 10; // 대화 요청에 포함하는 최근 턴 수
        @NotNull
        private Duration timeout = Duration.ofSeconds(60); // AI 호출 최대 대기 시간
    }

    public boolean isAdmin(Long userId) {
        return adminId != 0 && userId != null && userId == adminId;
    }

    /**
     * 필수 설정 검사. 누락 항목은 로그로 남기고 false 반환
     */
    public boolean validate() {
        List<String> missing = new ArrayList<>();
        if (telegram.getToken() == null || telegram.getToken().isBlank()) {
            missing.add("TELEGRAM_BOT_TOKEN");
        }
        if (gemini.getApiKey() == null || gemini.getApiKey().isBlank()) {
            missing.add("GEMINI_API_KEY");
        }
        if (adminId == 0) {
            missing.add("ADMIN_ID");
        }

        if (!missing.isEmpty()) {
            log.error("Missing required environment variables: {}", String.join(", ", missing));
            return false;
        }
        return true;
    }

    //상태 엔드포인트용 봇 정보
    public Map<String, Object> getBotInfo() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("bot_username", botUsername);
        info.put("webhook_configured", webhookUrl != null && !webhookUrl.isBlank());
        info.put("admin_id", adminId);
        info.put("max_message_length", maxMessageLength);
        info.put("allowed_image_types", allowedImageTypes);
        return info;
    }
}
