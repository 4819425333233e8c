package com.example.geminibot.client;

/**
 * 생성형 AI 백엔드 호출 실패 (네트워크 오류, 빈 응답 포함)
 */
public class GenerativeAiException extends RuntimeException {

    public GenerativeAiException(String message) {
        super(message);
    }

    public GenerativeAiException(String message, Throwable cause) {
        super(message, cause);
    }
}
