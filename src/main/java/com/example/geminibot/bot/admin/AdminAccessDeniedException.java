package com.example.geminibot.bot.admin;

import lombok.Getter;

/**
 * 관리자가 아닌 사용자가 관리자 전용 명령을 호출한 경우
 */
@Getter
public class AdminAccessDeniedException extends RuntimeException {

    private final Long userId;

    public AdminAccessDeniedException(Long userId, String action) {
        super("User " + userId + " is not allowed to run " + action);
        this.userId = userId;
    }
}
