package com.example.geminibot.client.telegram;

import com.example.geminibot.bot.EventType;
import com.example.geminibot.bot.InboundEvent;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Telegram Update JSON 을 {@link InboundEvent} 로 변환
 * 처리하지 않는 업데이트 종류(스티커, 편집 메시지 등)와 보낸 사람이나 채팅이 없는 업데이트는 빈 값 반환
 */
@Slf4j
@Component
public class TelegramUpdateMapper {

    public Optional<InboundEvent> toEvent(JsonNode update) {
        long updateId = update.path("update_id").asLong();

        JsonNode callback = update.path("callback_query");
        if (!callback.isMissingNode()) {
            if (!hasSenderAndChat(updateId, callback.path("from"), callback.path("message").path("chat"))) {
                return Optional.empty();
            }
            return Optional.of(baseBuilder(updateId, callback.path("message").path("chat"), callback.path("from"))
                    .type(EventType.CALLBACK)
                    .callbackId(callback.path("id").asText(null))
                    .callbackData(callback.path("data").asText(""))
                    .build());
        }

        JsonNode message = update.path("message");
        if (message.isMissingNode()) {
            log.debug("Ignoring update {} without message", updateId);
            return Optional.empty();
        }
        if (!hasSenderAndChat(updateId, message.path("from"), message.path("chat"))) {
            return Optional.empty();
        }

        InboundEvent.InboundEventBuilder builder = baseBuilder(updateId, message.path("chat"), message.path("from"));

        JsonNode photos = message.path("photo");
        if (photos.isArray() && !photos.isEmpty()) {
            // 마지막 항목이 가장 큰 해상도
            JsonNode largest = photos.get(photos.size() - 1);
            return Optional.of(builder.type(EventType.PHOTO)
                    .photoFileId(largest.path("file_id").asText())
                    .photoFileSize(largest.path("file_size").asLong(0))
                    .caption(message.path("caption").asText(null))
                    .build());
        }

        String text = message.path("text").asText(null);
        if (text == null || text.isBlank()) {
            log.debug("Ignoring update {} without text or photo", updateId);
            return Optional.empty();
        }

        if (text.startsWith("/")) {
            String[] tokens = text.trim().split("\\s+");
            String command = tokens[0].substring(1);
            int mention = command.indexOf('@');
            if (mention >= 0) {
                command = command.substring(0, mention);
            }
            return Optional.of(builder.type(EventType.COMMAND)
                    .text(text)
                    .command(command.toLowerCase(Locale.ROOT))
                    .args(Arrays.asList(tokens).subList(1, tokens.length))
                    .build());
        }

        return Optional.of(builder.type(EventType.TEXT).text(text).build());
    }

    //채널 게시물이나 익명 메시지처럼 사용자 ID 가 없으면 사용자별 상태에 넣을 수 없음
    private boolean hasSenderAndChat(long updateId, JsonNode from, JsonNode chat) {
        if (!from.path("id").canConvertToLong() || !chat.path("id").canConvertToLong()) {
            log.debug("Ignoring update {} without sender or chat id", updateId);
            return false;
        }
        return true;
    }

    private InboundEvent.InboundEventBuilder baseBuilder(long updateId, JsonNode chat, JsonNode from) {
        return InboundEvent.builder()
                .updateId(updateId)
                .chatId(chat.path("id").asLong())
                .userId(from.path("id").asLong())
                .username(from.path("username").asText(null))
                .firstName(from.path("first_name").asText(null));
    }
}
