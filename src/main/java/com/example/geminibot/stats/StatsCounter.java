package com.example.geminibot.stats;

import java.time.Duration;
import java.time.Instant;

/**
 * 단조 증가 카운터 묶음
 *
 * 증가와 스냅샷이 같은 모니터를 공유하므로 스냅샷은 항상 한 시점의 일관된 값을 가진다.
 */
public class StatsCounter {

    private final long[] values = new long[StatCounter.values().length];
    private final Instant startTime;

    public StatsCounter(Instant startTime) {
        if (startTime == null) {
            throw new IllegalArgumentException("startTime must not be null");
        }
        this.startTime = startTime;
    }

    public synchronized void increment(StatCounter counter) {
        if (counter == null) {
            throw new IllegalArgumentException("counter must not be null");
        }
        values[counter.ordinal()]++;
    }

    public void increment(String counterName) {
        increment(StatCounter.fromKey(counterName));
    }

    public synchronized long get(StatCounter counter) {
        return values[counter.ordinal()];
    }

    public synchronized StatsSnapshot snapshot(Instant now) {
        return StatsSnapshot.builder()
                .messagesProcessed(values[StatCounter.MESSAGES_PROCESSED.ordinal()])
                .imagesAnalyzed(values[StatCounter.IMAGES_ANALYZED.ordinal()])
                .imagesGenerated(values[StatCounter.IMAGES_GENERATED.ordinal()])
                .errors(values[StatCounter.ERRORS.ordinal()])
                .startTime(startTime)
                .uptimeSeconds(Math.max(0, Duration.between(startTime, now).getSeconds()))
                .build();
    }

    public Instant getStartTime() {
        return startTime;
    }
}
