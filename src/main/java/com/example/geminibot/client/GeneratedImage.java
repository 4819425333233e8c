package com.example.geminibot.client;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 이미지 생성 결과 (이미지 바이트 + 모델이 함께 돌려준 설명)
 */
@Getter
@AllArgsConstructor
public class GeneratedImage {
    private final byte[] data;
    private final String description;
}
