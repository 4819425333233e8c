package com.example.geminibot.ratelimiter.model;

import com.example.geminibot.util.TimeUtil;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 사용자 한 명의 Sliding Window Log 상태
 * 모든 접근은 인스턴스 모니터를 잡은 상태에서 이루어져야 함
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SlidingWindowLogState {
    private Deque<Long> requestLog; // 허용된 요청 타임스탬프 (오래된 순)
    private int limit; // 윈도우 내 최대 요청 수
    private long windowSizeMillis; // 윈도우 크기 (밀리초)

    public static SlidingWindowLogState createSlidingWindowLog(int limit, long windowSizeSeconds) {
        return new SlidingWindowLogState(new ArrayDeque<>(), limit, TimeUtil.secondsToMillis(windowSizeSeconds));
    }
}
