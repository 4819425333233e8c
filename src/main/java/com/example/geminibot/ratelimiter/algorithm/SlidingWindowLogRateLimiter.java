package com.example.geminibot.ratelimiter.algorithm;

import com.example.geminibot.ratelimiter.core.RateLimitDecision;
import com.example.geminibot.ratelimiter.core.RateLimiter;
import com.example.geminibot.ratelimiter.model.SlidingWindowLogState;
import com.example.geminibot.util.TimeUtil;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sliding Window Log Algorithm
 *
 * 동작 원리:
 * - 사용자별로 허용된 요청의 타임스탬프를 로그에 저장
 * - 새 요청 시 윈도우를 벗어난 로그를 제거하고 남은 요청 수로 허용 여부 판단
 * - 판단과 기록은 같은 임계 구역 안에서 수행되므로 같은 슬롯을 두 요청이 동시에 차지할 수 없음
 *
 * 윈도우 경계: 타임스탬프가 정확히 windowSize 만큼 지난 요청은 윈도우 밖으로 취급
 */
@Slf4j
public class SlidingWindowLogRateLimiter implements RateLimiter {

    private final ConcurrentHashMap<Long, SlidingWindowLogState> logs = new ConcurrentHashMap<>();
    private final int defaultLimit;
    private final long defaultWindowSizeSeconds;

    public SlidingWindowLogRateLimiter() {
        this(10, 60); // 기본: 60초 윈도우에 10개 메시지
    }

    /**
     * 사용자 정의 설정으로 SlidingWindowLogRateLimiter 생성
     *
     * @param limit 윈도우 내 최대 요청 수
     * @param windowSizeSeconds 윈도우 크기 (초)
     */
    public SlidingWindowLogRateLimiter(int limit, long windowSizeSeconds) {
        if (limit <= 0) {
            throw new IllegalArgumentException("Limit must be positive");
        }
        if (windowSizeSeconds <= 0) {
            throw new IllegalArgumentException("Window size must be positive");
        }

        this.defaultLimit = limit;
        this.defaultWindowSizeSeconds = windowSizeSeconds;

        log.info("SlidingWindowLogRateLimiter initialized - limit: {}, windowSize: {}s",
                limit, windowSizeSeconds);
    }

    @Override
    public RateLimitDecision allowRequest(Long userId, long nowMillis) {
        if (userId == null) {
            throw new IllegalArgumentException("userId must not be null");
        }

        final RateLimitDecision[] result = new RateLimitDecision[1];

        // compute 는 키 단위로 원자적이므로 cleanupInactiveLogs 와 경합해도 기록이 유실되지 않음
        logs.compute(userId, (id, existing) -> {
            SlidingWindowLogState logState = existing != null ? existing
                    : SlidingWindowLogState.createSlidingWindowLog(defaultLimit, defaultWindowSizeSeconds);

            synchronized (logState) {
                cleanupExpiredRequests(logState, nowMillis);

                int currentRequestCount = logState.getRequestLog().size();

                if (currentRequestCount < defaultLimit) {
                    logState.getRequestLog().offerLast(nowMillis);

                    long resetTime = calculateResetTime(logState, nowMillis);

                    log.debug("Request allowed for user: {} - count: {}/{}",
                            id, currentRequestCount + 1, defaultLimit);

                    result[0] = RateLimitDecision.admit(id, currentRequestCount + 1, defaultLimit, resetTime);
                } else {
                    long resetTime = calculateResetTime(logState, nowMillis);
                    long retryAfter = TimeUtil.calculateRetryAfterSeconds(resetTime, nowMillis);

                    log.debug("Request rejected for user: {} - limit exceeded {}/{}, retry after: {}s",
                            id, currentRequestCount, defaultLimit, retryAfter);

                    result[0] = RateLimitDecision.reject(id, currentRequestCount, resetTime, retryAfter);
                }
            }
            return logState;
        });

        return result[0];
    }

    //윈도우 밖의 만료된 요청 제거
    private void cleanupExpiredRequests(SlidingWindowLogState logState, long nowMillis) {
        long windowStartTime = nowMillis - logState.getWindowSizeMillis();

        while (!logState.getRequestLog().isEmpty()
                && logState.getRequestLog().peekFirst() <= windowStartTime) {
            logState.getRequestLog().pollFirst();
        }
    }

    //다음 요청이 가능한 시간 계산
    private long calculateResetTime(SlidingWindowLogState logState, long nowMillis) {
        Long oldestRequest = logState.getRequestLog().peekFirst();
        if (oldestRequest == null) {
            return nowMillis;
        }
        // 가장 오래된 요청이 윈도우에서 빠지는 시간
        return oldestRequest + logState.getWindowSizeMillis();
    }

    @Override
    public void reset(Long userId) {
        logs.remove(userId);
        log.debug("Reset log for user: {}", userId);
    }

    @Override
    public Map<String, Object> getStats(Long userId) {
        SlidingWindowLogState logState = logs.get(userId);
        Map<String, Object> stats = new HashMap<>();
        stats.put("algorithm", getAlgorithmName());
        stats.put("userId", userId);

        if (logState == null) {
            stats.put("status", "No log found");
            return stats;
        }

        synchronized (logState) {
            int currentRequestCount = logState.getRequestLog().size();

            stats.put("currentRequests", currentRequestCount);
            stats.put("limit", logState.getLimit());
            stats.put("remainingRequests", Math.max(0, defaultLimit - currentRequestCount));
            stats.put("windowSizeSeconds", logState.getWindowSizeMillis() / 1000);

            if (!logState.getRequestLog().isEmpty()) {
                stats.put("oldestRequestTime", logState.getRequestLog().peekFirst());
                stats.put("oldestRequestTimeFormatted", TimeUtil.formatTimestamp(logState.getRequestLog().peekFirst()));
                stats.put("newestRequestTime", logState.getRequestLog().peekLast());
                stats.put("newestRequestTimeFormatted", TimeUtil.formatTimestamp(logState.getRequestLog().peekLast()));
            }
        }

        return stats;
    }

    /**
     * 사용자 로그에 남아 있는 타임스탬프 수 (정리하지 않고 그대로 반환)
     */
    public int getRequestCount(Long userId) {
        SlidingWindowLogState logState = logs.get(userId);
        if (logState == null) {
            return 0;
        }
        synchronized (logState) {
            return logState.getRequestLog().size();
        }
    }

    //추적 중인 사용자 수
    public int getTrackedUserCount() {
        return logs.size();
    }

    @Override
    public String getAlgorithmName() {
        return "sliding-window-log";
    }

    //정리 후 로그가 비어 있는 사용자 제거 (메모리 관리 용도)
    @Override
    public int cleanupInactiveLogs(long nowMillis) {
        final int[] removedCount = {0};

        for (Long userId : logs.keySet()) {
            logs.computeIfPresent(userId, (id, logState) -> {
                synchronized (logState) {
                    cleanupExpiredRequests(logState, nowMillis);
                    if (logState.getRequestLog().isEmpty()) {
                        removedCount[0]++;
                        return null;
                    }
                    return logState;
                }
            });
        }

        if (removedCount[0] > 0) {
            log.info("Cleaned up {} inactive logs", removedCount[0]);
        }

        return removedCount[0];
    }
}
