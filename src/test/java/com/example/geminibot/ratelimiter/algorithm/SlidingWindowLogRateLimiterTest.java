package com.example.geminibot.ratelimiter.algorithm;

import com.example.geminibot.ratelimiter.core.RateLimitDecision;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Sliding Window Log Rate Limiter 테스트
 * 시간은 모두 명시적으로 전달하여 결정적으로 검증합니다.
 */
@Slf4j
@DisplayName("Sliding Window Log Rate Limiter 테스트")
class SlidingWindowLogRateLimiterTest {

    private static final long SECOND = 1000L;

    private SlidingWindowLogRateLimiter rateLimiter;
    private final Long testUserId = 123L;

    @BeforeEach
    void setUp() {
        rateLimiter = new SlidingWindowLogRateLimiter(2, 60);
        log.info("Sliding Window Log Rate Limiter 초기화 완료 - limit: 2, windowSize: 60s");
    }

    @Test
    @DisplayName("시나리오 - t=0,1,2 호출은 허용/허용/거부, t=61 호출은 다시 허용")
    void testWindowRollover() {
        RateLimitDecision first = rateLimiter.allowRequest(testUserId, 0);
        RateLimitDecision second = rateLimiter.allowRequest(testUserId, SECOND);
        RateLimitDecision third = rateLimiter.allowRequest(testUserId, 2 * SECOND);

        assertTrue(first.isAllowed(), "첫 번째 요청은 허용되어야 합니다");
        assertTrue(second.isAllowed(), "두 번째 요청은 허용되어야 합니다");
        assertFalse(third.isAllowed(), "세 번째 요청은 거부되어야 합니다");
        assertEquals(59, third.getRetryAfterSeconds(), "가장 오래된 요청이 빠지는 t=60 까지 기다려야 합니다");

        RateLimitDecision fourth = rateLimiter.allowRequest(testUserId, 61 * SECOND);
        assertTrue(fourth.isAllowed(), "윈도우가 지난 뒤의 요청은 허용되어야 합니다");
        assertEquals(1, rateLimiter.getRequestCount(testUserId), "t=0, t=1 기록은 제거되어야 합니다");

        log.info("윈도우 이동 테스트 완료 - remaining: {}", fourth.getRemainingRequests());
    }

    @Test
    @DisplayName("N+1 번째 요청 - 처음 N 개만 허용")
    void testLimitPlusOne() {
        SlidingWindowLogRateLimiter limiter = new SlidingWindowLogRateLimiter(5, 10);

        for (int i = 0; i < 5; i++) {
            RateLimitDecision result = limiter.allowRequest(testUserId, i * 100L);
            assertTrue(result.isAllowed(), (i + 1) + "번째 요청은 허용되어야 합니다");
            assertEquals(4 - i, result.getRemainingRequests(), "남은 요청 수가 올바르지 않습니다");
            assertEquals(i + 1, result.getRequestsInWindow(), "윈도우 내 기록 수가 올바르지 않습니다");
            assertEquals(testUserId, result.getUserId());
        }

        RateLimitDecision rejected = limiter.allowRequest(testUserId, 500);
        assertFalse(rejected.isAllowed(), "6번째 요청은 거부되어야 합니다");
        assertEquals(0, rejected.getRemainingRequests(), "거부 시 남은 요청 수는 0이어야 합니다");
        assertEquals(5, rejected.getRequestsInWindow(), "거부된 요청은 기록되지 않아야 합니다");
        assertEquals(10, rejected.getRetryAfterSeconds(), "재시도 시간은 리셋 시각까지 남은 초여야 합니다");
        assertEquals(10 * SECOND, rejected.getWindowResetMillis(), "리셋 시간은 가장 오래된 요청 + 윈도우여야 합니다");

        assertTrue(limiter.allowRequest(testUserId, 10 * SECOND).isAllowed(),
                "윈도우가 지나면 다시 허용되어야 합니다");
    }

    @Test
    @DisplayName("윈도우 경계 - 정확히 윈도우 크기만큼 지난 기록은 윈도우 밖")
    void testExactBoundaryIsOutsideWindow() {
        rateLimiter.allowRequest(testUserId, 0);
        rateLimiter.allowRequest(testUserId, 0);

        assertFalse(rateLimiter.allowRequest(testUserId, 60 * SECOND - 1).isAllowed(),
                "윈도우 끝 직전에는 거부되어야 합니다");
        assertTrue(rateLimiter.allowRequest(testUserId, 60 * SECOND).isAllowed(),
                "정확히 윈도우 크기가 지나면 허용되어야 합니다");
    }

    @Test
    @DisplayName("보관된 기록 수는 마지막 호출 기준 윈도우 내 허용 호출 수와 같음")
    void testRetainedCountMatchesTrailingWindow() {
        SlidingWindowLogRateLimiter limiter = new SlidingWindowLogRateLimiter(100, 10);
        long[] callTimes = {0, 2_000, 4_000, 9_000, 11_000, 13_000, 19_500, 21_000};

        for (long time : callTimes) {
            limiter.allowRequest(testUserId, time);
        }

        long last = callTimes[callTimes.length - 1];
        long expected = 0;
        for (long time : callTimes) {
            if (time > last - 10 * SECOND) {
                expected++;
            }
        }
        assertEquals(expected, limiter.getRequestCount(testUserId), "윈도우 밖 기록이 남아 있으면 안 됩니다");
    }

    @Test
    @DisplayName("사용자별 격리 테스트 - 다른 사용자는 독립적으로 동작해야 함")
    void testUserIsolation() {
        Long user1 = 100L;
        Long user2 = 200L;

        rateLimiter.allowRequest(user1, 0);
        rateLimiter.allowRequest(user1, 0);
        assertFalse(rateLimiter.allowRequest(user1, 0).isAllowed(), "user1 은 한도를 초과했습니다");

        assertTrue(rateLimiter.allowRequest(user2, 0).isAllowed(), "user2 는 영향을 받지 않아야 합니다");
        assertEquals(2, rateLimiter.getTrackedUserCount(), "두 사용자가 추적되어야 합니다");
    }

    @Test
    @DisplayName("리셋 후에는 다시 허용되고 통계가 비어 있어야 함")
    void testReset() {
        rateLimiter.allowRequest(testUserId, 0);
        rateLimiter.allowRequest(testUserId, 0);

        Map<String, Object> stats = rateLimiter.getStats(testUserId);
        assertEquals(2, stats.get("currentRequests"), "현재 요청 수가 통계에 포함되어야 합니다");
        assertEquals(0, stats.get("remainingRequests"), "남은 요청 수가 0이어야 합니다");

        rateLimiter.reset(testUserId);

        assertEquals("No log found", rateLimiter.getStats(testUserId).get("status"), "리셋 후 로그가 없어야 합니다");
        assertTrue(rateLimiter.allowRequest(testUserId, 0).isAllowed(), "리셋 후 요청은 허용되어야 합니다");
    }

    @Test
    @DisplayName("비활성 로그 정리 - 윈도우가 비어 있는 사용자만 제거")
    void testCleanupInactiveLogs() {
        rateLimiter.allowRequest(1L, 0);
        rateLimiter.allowRequest(2L, 30 * SECOND);

        int removed = rateLimiter.cleanupInactiveLogs(70 * SECOND);

        assertEquals(1, removed, "t=0 에만 요청한 사용자가 제거되어야 합니다");
        assertEquals(0, rateLimiter.getRequestCount(1L), "제거된 사용자의 기록은 없어야 합니다");
        assertEquals(1, rateLimiter.getRequestCount(2L), "윈도우 안의 기록은 유지되어야 합니다");
    }

    @Test
    @DisplayName("잘못된 설정과 null 사용자는 즉시 실패")
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new SlidingWindowLogRateLimiter(0, 60));
        assertThrows(IllegalArgumentException.class, () -> new SlidingWindowLogRateLimiter(10, 0));
        assertThrows(IllegalArgumentException.class, () -> rateLimiter.allowRequest(null, 0));
    }

    @Test
    @DisplayName("동시 요청 - 같은 사용자에게 한도보다 많이 허용되지 않음")
    void testConcurrentAdmission() throws Exception {
        SlidingWindowLogRateLimiter limiter = new SlidingWindowLogRateLimiter(50, 60);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);

        List<Callable<Boolean>> calls = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            calls.add(() -> {
                start.await();
                return limiter.allowRequest(testUserId, 1_000).isAllowed();
            });
        }

        List<Future<Boolean>> futures = new ArrayList<>();
        for (Callable<Boolean> call : calls) {
            futures.add(executor.submit(call));
        }
        start.countDown();

        int admitted = 0;
        for (Future<Boolean> future : futures) {
            if (future.get(10, TimeUnit.SECONDS)) {
                admitted++;
            }
        }
        executor.shutdown();

        assertEquals(50, admitted, "허용된 요청 수는 정확히 한도와 같아야 합니다");
        assertEquals(50, limiter.getRequestCount(testUserId), "기록된 타임스탬프 수도 한도와 같아야 합니다");
    }
}
