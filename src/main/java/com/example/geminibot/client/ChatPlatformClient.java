package com.example.geminibot.client;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * 채팅 플랫폼 API 클라이언트
 * 모든 메서드는 실패 시 {@link ChatPlatformException} 을 던진다.
 */
public interface ChatPlatformClient {

    void sendMessage(Long chatId, String text, ParseMode parseMode);

    default void sendMessage(Long chatId, String text) {
        sendMessage(chatId, text, ParseMode.PLAIN);
    }

    /**
     * 버튼 행(row) 목록이 붙은 메시지 전송
     */
    void sendMenu(Long chatId, String text, List<List<MenuButton>> rows);

    void sendPhoto(Long chatId, byte[] photo, String caption);

    void answerCallback(String callbackId);

    byte[] downloadFile(String fileId);

    /**
     * long polling 으로 업데이트 조회
     *
     * @param offset 다음에 받을 업데이트 ID
     * @param timeoutSeconds 서버 대기 시간
     * @return 원본 업데이트 JSON 목록
     */
    List<JsonNode> getUpdates(long offset, int timeoutSeconds);
}
