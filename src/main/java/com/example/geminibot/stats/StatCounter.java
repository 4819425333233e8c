package com.example.geminibot.stats;

import java.util.Arrays;

/**
 * 봇 사용량 카운터 종류
 */
public enum StatCounter {
    MESSAGES_PROCESSED("messages_processed"),
    IMAGES_ANALYZED("images_analyzed"),
    IMAGES_GENERATED("images_generated"),
    ERRORS("errors");

    private final String key;

    StatCounter(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    /**
     * 외부 노출용 이름으로 카운터 조회. 모르는 이름은 프로그래밍 오류이므로 즉시 실패
     */
    public static StatCounter fromKey(String key) {
        return Arrays.stream(values())
                .filter(counter -> counter.key.equals(key))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown stat counter: " + key));
    }
}
