package com.example.geminibot.stats;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * 특정 시점의 카운터 값 복사본
 */
@Getter
@Builder
@ToString
@AllArgsConstructor
public class StatsSnapshot {

    private final long messagesProcessed;
    private final long imagesAnalyzed;
    private final long imagesGenerated;
    private final long errors;
    private final Instant startTime; // 프로세스 시작 시각
    private final long uptimeSeconds;

    public long get(StatCounter counter) {
        return switch (counter) {
            case MESSAGES_PROCESSED -> messagesProcessed;
            case IMAGES_ANALYZED -> imagesAnalyzed;
            case IMAGES_GENERATED -> imagesGenerated;
            case ERRORS -> errors;
        };
    }
}
