package com.example.geminibot.controller;

import com.example.geminibot.bot.InboundProcessingLoop;
import com.example.geminibot.client.telegram.TelegramUpdateMapper;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

/**
 * Telegram webhook 수신
 * 업데이트를 변환해 처리 루프에 넣기만 하고 바로 응답한다.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class WebhookController {

    private final TelegramUpdateMapper mapper;
    private final InboundProcessingLoop processingLoop;

    @PostMapping("/webhook")
    public Map<String, Object> receive(@RequestBody JsonNode update) {
        log.debug("Received webhook update: {}", update.path("update_id").asText());

        boolean queued = mapper.toEvent(update)
                .map(processingLoop::submit)
                .orElse(false);

        return Map.of(
                "status", queued ? "received" : "ignored",
                "timestamp", Instant.now());
    }
}
