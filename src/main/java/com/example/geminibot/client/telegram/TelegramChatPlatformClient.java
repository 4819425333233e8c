package com.example.geminibot.client.telegram;

import com.example.geminibot.client.ChatPlatformClient;
import com.example.geminibot.client.ChatPlatformException;
import com.example.geminibot.client.MenuButton;
import com.example.geminibot.client.ParseMode;
import com.example.geminibot.config.BotProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.DefaultUriBuilderFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Telegram Bot HTTP API 클라이언트
 */
@Slf4j
public class TelegramChatPlatformClient implements ChatPlatformClient {

    private final RestClient restClient;
    private final String token;

    public TelegramChatPlatformClient(RestClient.Builder restClientBuilder, BotProperties.Telegram config) {
        // 토큰의 ':' 와 file_path 의 '/' 는 경로에 그대로 들어가야 함
        DefaultUriBuilderFactory uriFactory = new DefaultUriBuilderFactory(config.getApiBaseUrl());
        uriFactory.setEncodingMode(DefaultUriBuilderFactory.EncodingMode.URI_COMPONENT);
        this.restClient = restClientBuilder.uriBuilderFactory(uriFactory).build();
        this.token = config.getToken();
    }

    @Override
    public void sendMessage(Long chatId, String text, ParseMode parseMode) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("chat_id", chatId);
        body.put("text", text);
        if (parseMode == ParseMode.MARKDOWN_V2) {
            body.put("parse_mode", "MarkdownV2");
        }
        call("sendMessage", body);
    }

    @Override
    public void sendMenu(Long chatId, String text, List<List<MenuButton>> rows) {
        List<List<Map<String, String>>> keyboard = new ArrayList<>();
        for (List<MenuButton> row : rows) {
            List<Map<String, String>> buttons = new ArrayList<>();
            for (MenuButton button : row) {
                buttons.add(Map.of("text", button.getLabel(), "callback_data", button.getCallbackData()));
            }
            keyboard.add(buttons);
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("chat_id", chatId);
        body.put("text", text);
        body.put("reply_markup", Map.of("inline_keyboard", keyboard));
        call("sendMessage", body);
    }

    @Override
    public void sendPhoto(Long chatId, byte[] photo, String caption) {
        MultiValueMap<String, Object> parts = new LinkedMultiValueMap<>();
        parts.add("chat_id", String.valueOf(chatId));
        if (caption != null) {
            parts.add("caption", caption);
        }
        parts.add("photo", new ByteArrayResource(photo) {
            @Override
            public String getFilename() {
                return "generated.png";
            }
        });

        try {
            JsonNode response = restClient.post()
                    .uri("/bot{token}/sendPhoto", token)
                    .contentType(MediaType.MULTIPART_FORM_DATA)
                    .body(parts)
                    .retrieve()
                    .body(JsonNode.class);
            checkOk("sendPhoto", response);
        } catch (RestClientException e) {
            throw new ChatPlatformException("Telegram sendPhoto failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void answerCallback(String callbackId) {
        call("answerCallbackQuery", Map.of("callback_query_id", callbackId));
    }

    @Override
    public byte[] downloadFile(String fileId) {
        JsonNode file = call("getFile", Map.of("file_id", fileId));
        String filePath = file.path("file_path").asText(null);
        if (filePath == null) {
            throw new ChatPlatformException("Telegram getFile returned no file_path for " + fileId);
        }

        try {
            byte[] content = restClient.get()
                    .uri("/file/bot{token}/{path}", token, filePath)
                    .retrieve()
                    .body(byte[].class);
            if (content == null) {
                throw new ChatPlatformException("Empty file content for " + fileId);
            }
            return content;
        } catch (RestClientException e) {
            throw new ChatPlatformException("Telegram file download failed: " + e.getMessage(), e);
        }
    }

    @Override
    public List<JsonNode> getUpdates(long offset, int timeoutSeconds) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("offset", offset);
        body.put("timeout", timeoutSeconds);
        JsonNode result = call("getUpdates", body);

        List<JsonNode> updates = new ArrayList<>();
        result.forEach(updates::add);
        return updates;
    }

    //Bot API 메서드 호출 후 result 노드 반환
    private JsonNode call(String method, Map<String, ?> body) {
        try {
            JsonNode response = restClient.post()
                    .uri("/bot{token}/{method}", token, method)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(JsonNode.class);
            checkOk(method, response);
            return response.path("result");
        } catch (RestClientException e) {
            throw new ChatPlatformException("Telegram " + method + " failed: " + e.getMessage(), e);
        }
    }

    private void checkOk(String method, JsonNode response) {
        if (response == null || !response.path("ok").asBoolean(false)) {
            String description = response != null ? response.path("description").asText("unknown error") : "empty response";
            log.warn("Telegram {} rejected: {}", method, description);
            throw new ChatPlatformException("Telegram " + method + " rejected: " + description);
        }
    }
}
