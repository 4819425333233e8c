package com.example.geminibot.ratelimiter.core;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 사용자 한 명의 메시지 허용 판정
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class RateLimitDecision {

    private final Long userId;
    private final boolean allowed;
    private final int requestsInWindow; // 이번 요청을 포함해 윈도우에 남은 기록 수
    private final int remainingRequests;
    private final long windowResetMillis; // 가장 오래된 기록이 윈도우를 벗어나는 시각 (epoch 밀리초)
    private final long retryAfterSeconds; // 허용이면 0

    public static RateLimitDecision admit(Long userId, int requestsInWindow, int limit, long windowResetMillis) {
        return new RateLimitDecision(userId, true, requestsInWindow,
                Math.max(0, limit - requestsInWindow), windowResetMillis, 0);
    }

    public static RateLimitDecision reject(Long userId, int requestsInWindow, long windowResetMillis,
                                           long retryAfterSeconds) {
        return new RateLimitDecision(userId, false, requestsInWindow, 0, windowResetMillis, retryAfterSeconds);
    }
}
