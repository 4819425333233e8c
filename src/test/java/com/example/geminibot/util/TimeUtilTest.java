package com.example.geminibot.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("시간 유틸리티 테스트")
class TimeUtilTest {

    @Test
    @DisplayName("가동 시간 포맷")
    void testFormatUptime() {
        assertEquals("0d 0h 0m", TimeUtil.formatUptime(Duration.ZERO));
        assertEquals("1d 2h 3m", TimeUtil.formatUptime(Duration.ofDays(1).plusHours(2).plusMinutes(3).plusSeconds(59)));
        assertEquals("0d 0h 0m", TimeUtil.formatUptime(Duration.ofSeconds(-5)));
    }

    @Test
    @DisplayName("재시도 시간 계산 - 지난 리셋 시간은 0")
    void testRetryAfter() {
        assertEquals(0, TimeUtil.calculateRetryAfterSeconds(1_000, 2_000));
        assertEquals(1, TimeUtil.calculateRetryAfterSeconds(2_500, 2_000));
        assertEquals(58, TimeUtil.calculateRetryAfterSeconds(60_000, 2_500));
    }

    @Test
    @DisplayName("초를 밀리초로 변환")
    void testSecondsToMillis() {
        assertEquals(60_000, TimeUtil.secondsToMillis(60));
    }
}
