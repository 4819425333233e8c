package com.example.geminibot.util;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * 시간 관련 유틸리티 클래스
 */
public class TimeUtil {

    private static final DateTimeFormatter FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private TimeUtil() {
    }

    //초를 밀리초로 변환
    public static long secondsToMillis(long seconds) {
        return seconds * 1000;
    }

    //밀리초를 사람이 읽기 쉬운 형태로 변환
    public static String formatTimestamp(long timestampMillis) {
        return formatTimestamp(Instant.ofEpochMilli(timestampMillis));
    }

    public static String formatTimestamp(Instant instant) {
        LocalDateTime dateTime = LocalDateTime.ofInstant(instant, ZoneId.systemDefault());
        return dateTime.format(FORMATTER);
    }

    //재시도 권장 시간 계산 (초 단위)
    public static long calculateRetryAfterSeconds(long resetTimeMillis, long nowMillis) {
        if (resetTimeMillis <= nowMillis) {
            return 0;
        }
        return (resetTimeMillis - nowMillis) / 1000 + 1; // 1초 여유
    }

    /**
     * 가동 시간을 "1d 2h 3m" 형태로 변환. 음수 구간은 0 으로 취급
     */
    public static String formatUptime(Duration uptime) {
        long totalSeconds = Math.max(0, uptime.getSeconds());
        long days = totalSeconds / 86_400;
        long hours = (totalSeconds % 86_400) / 3600;
        long minutes = (totalSeconds % 3600) / 60;
        return days + "d " + hours + "h " + minutes + "m";
    }
}
