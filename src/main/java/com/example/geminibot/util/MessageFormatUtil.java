package com.example.geminibot.util;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 채팅 플랫폼으로 보내는 메시지 문자열 처리 유틸리티
 */
public class MessageFormatUtil {

    public static final String EMPTY_RESPONSE = "No response generated.";
    private static final String TRUNCATED_SUFFIX = "\n\n\\.\\.\\. \\(truncated\\)"; // MarkdownV2 이스케이프 완료
    private static final Pattern MARKDOWN_SPECIAL = Pattern.compile("([_*\\[\\]()~`>#+\\-=|{}.!\\\\])");

    private MessageFormatUtil() {
    }

    /**
     * Markdown 특수문자를 이스케이프하고 최대 길이를 넘으면 문장 경계에서 자름
     */
    public static String formatMessage(String text, int maxLength) {
        if (text == null || text.isEmpty()) {
            return EMPTY_RESPONSE;
        }

        String escaped = MARKDOWN_SPECIAL.matcher(text).replaceAll("\\\\$1");
        if (escaped.length() <= maxLength) {
            return escaped;
        }

        // 문장 경계가 너무 앞쪽이면 (70% 미만) 고정 위치에서 자름
        String head = escaped.substring(0, Math.max(0, maxLength - 100));
        int cutPoint = Math.max(head.lastIndexOf('.'), head.lastIndexOf('\n'));
        if (cutPoint > maxLength * 0.7) {
            return cutKeepingEscapes(escaped, cutPoint + 1) + TRUNCATED_SUFFIX;
        }
        return cutKeepingEscapes(escaped, Math.max(0, maxLength - TRUNCATED_SUFFIX.length())) + TRUNCATED_SUFFIX;
    }

    //이스케이프 쌍("\x")의 중간에서 잘리지 않도록 끝에 남은 단독 백슬래시 제거
    private static String cutKeepingEscapes(String escaped, int end) {
        int backslashes = 0;
        while (end - backslashes > 0 && escaped.charAt(end - backslashes - 1) == '\\') {
            backslashes++;
        }
        return escaped.substring(0, backslashes % 2 == 1 ? end - 1 : end);
    }

    public static String truncateText(String text, int maxLength) {
        return truncateText(text, maxLength, "...");
    }

    public static String truncateText(String text, int maxLength, String suffix) {
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, Math.max(0, maxLength - suffix.length())) + suffix;
    }

    public static boolean isAllowedImageType(String mimeType, List<String> allowedTypes) {
        if (mimeType == null) {
            return false;
        }
        String normalized = mimeType.toLowerCase(Locale.ROOT);
        return allowedTypes.stream().anyMatch(type -> type.toLowerCase(Locale.ROOT).equals(normalized));
    }

    public static double bytesToMegabytes(long sizeBytes) {
        return Math.round(sizeBytes / (1024.0 * 1024.0) * 100) / 100.0;
    }
}
