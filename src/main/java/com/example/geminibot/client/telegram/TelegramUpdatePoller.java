package com.example.geminibot.client.telegram;

import com.example.geminibot.bot.InboundProcessingLoop;
import com.example.geminibot.client.ChatPlatformClient;
import com.example.geminibot.client.ChatPlatformException;
import com.example.geminibot.config.BotProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * getUpdates long polling 으로 업데이트를 받아 처리 루프에 전달
 * webhook 을 쓰지 않는 배포에서만 활성화
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "bot.telegram", name = "polling-enabled", havingValue = "true")
public class TelegramUpdatePoller {

    private final ChatPlatformClient platform;
    private final TelegramUpdateMapper mapper;
    private final InboundProcessingLoop processingLoop;
    private final BotProperties properties;

    private long offset;

    @Scheduled(fixedDelay = 1000)
    public void poll() {
        List<JsonNode> updates;
        try {
            updates = platform.getUpdates(offset, properties.getTelegram().getPollingTimeoutSeconds());
        } catch (ChatPlatformException e) {
            log.warn("Polling for updates failed: {}", e.getMessage());
            return;
        }

        for (JsonNode update : updates) {
            offset = Math.max(offset, update.path("update_id").asLong() + 1);
            mapper.toEvent(update).ifPresent(processingLoop::submit);
        }
    }
}
