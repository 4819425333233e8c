package com.example.geminibot.config;

import com.example.geminibot.client.ChatPlatformClient;
import com.example.geminibot.client.GenerativeAiClient;
import com.example.geminibot.client.gemini.GeminiClient;
import com.example.geminibot.client.telegram.TelegramChatPlatformClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

/**
 * 외부 API 클라이언트 Bean 등록
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class ClientConfiguration {

    private final BotProperties properties;

    @Bean
    public ChatPlatformClient chatPlatformClient(RestClient.Builder restClientBuilder) {
        return new TelegramChatPlatformClient(restClientBuilder.clone(), properties.getTelegram());
    }

    @Bean
    public GenerativeAiClient generativeAiClient(RestClient.Builder restClientBuilder, ObjectMapper objectMapper) {
        return new GeminiClient(restClientBuilder.clone(), objectMapper, properties.getGemini());
    }

    //필수 설정이 없어도 상태 서버는 기동 (누락 항목은 validate() 에서 로그)
    @Bean
    public ApplicationRunner configurationCheck() {
        return args -> {
            if (properties.validate()) {
                log.info("Bot configuration validated - username: @{}, polling: {}",
                        properties.getBotUsername(), properties.getTelegram().isPollingEnabled());
            } else {
                log.warn("Bot started with incomplete configuration, chat features may not work");
            }
        };
    }
}
