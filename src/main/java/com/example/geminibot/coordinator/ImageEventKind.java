package com.example.geminibot.coordinator;

import com.example.geminibot.stats.StatCounter;

/**
 * 이미지 처리 이벤트 종류와 대응 카운터
 */
public enum ImageEventKind {
    ANALYZED(StatCounter.IMAGES_ANALYZED),
    GENERATED(StatCounter.IMAGES_GENERATED);

    private final StatCounter counter;

    ImageEventKind(StatCounter counter) {
        this.counter = counter;
    }

    public StatCounter getCounter() {
        return counter;
    }
}
