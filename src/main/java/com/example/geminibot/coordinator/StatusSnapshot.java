package com.example.geminibot.coordinator;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * 상태 서버와 관리자 명령이 읽는 집계 스냅샷
 */
@Getter
@Builder
@ToString
@AllArgsConstructor
public class StatusSnapshot {

    private final long uptimeSeconds;
    private final String uptimeFormatted;
    private final long messagesProcessed;
    private final long imagesAnalyzed;
    private final long imagesGenerated;
    private final long errors;
    private final int activeUsers;
    private final int contextSizeTotal; // 전체 사용자의 보관 턴 수 합계
    private final Instant startTime;
    private final Instant timestamp; // 스냅샷 생성 시각

    //에러율 (%), 처리 메시지가 없으면 1건 기준
    public double getErrorRate() {
        return errors * 100.0 / Math.max(messagesProcessed, 1);
    }

    public double getAverageMessagesPerUser() {
        return messagesProcessed / (double) Math.max(activeUsers, 1);
    }

    public long getTotalImagesProcessed() {
        return imagesAnalyzed + imagesGenerated;
    }
}
