package com.example.geminibot.ratelimiter.core;

import java.util.Map;

/**
 * 사용자별 메시지 요청 속도를 제한하는 Rate Limiter 인터페이스
 */
public interface RateLimiter {

    /**
     * 요청 허용 여부를 검사합니다.
     * 허용된 경우에만 요청 시간이 기록되며, 거부 시에는 아무 상태도 변경하지 않습니다.
     *
     * @param userId 유저 식별자
     * @param nowMillis 요청 시각 (epoch 밀리초)
     * @return Rate Limiting 결과
     */
    RateLimitDecision allowRequest(Long userId, long nowMillis);

    /**
     * 특정 사용자의 Rate Limiting 상태를 초기화합니다.
     *
     * @param userId 유저 식별자
     */
    void reset(Long userId);

    /**
     * 특정 사용자의 현재 상태 정보를 반환합니다.
     *
     * @param userId 유저 식별자
     * @return 상태 정보 Map
     */
    Map<String, Object> getStats(Long userId);

    /**
     * 비활성 사용자의 상태를 정리합니다.
     *
     * @param nowMillis 기준 시각 (epoch 밀리초)
     * @return 정리된 사용자 수
     */
    int cleanupInactiveLogs(long nowMillis);

    /**
     * 알고리즘 이름을 반환합니다.
     *
     * @return 알고리즘 이름
     */
    String getAlgorithmName();
}
