package com.example.geminibot.client;

/**
 * 채팅 플랫폼 API 호출 실패
 */
public class ChatPlatformException extends RuntimeException {

    public ChatPlatformException(String message) {
        super(message);
    }

    public ChatPlatformException(String message, Throwable cause) {
        super(message, cause);
    }
}
