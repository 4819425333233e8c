package com.example.geminibot.client;

import com.example.geminibot.context.ConversationTurn;

import java.util.List;

/**
 * 생성형 AI 백엔드 클라이언트
 * 모든 메서드는 실패 시 {@link GenerativeAiException} 을 던진다.
 */
public interface GenerativeAiClient {

    String generateResponse(String prompt);

    /**
     * 최근 대화 턴을 포함한 멀티턴 응답 생성
     */
    String chatWithContext(List<ConversationTurn> turns);

    String analyzeImage(byte[] image, String prompt);

    GeneratedImage generateImage(String prompt);
}
