package com.example.geminibot.bot;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.List;

/**
 * 처리 루프가 한 번에 하나씩 처리하는 사용자 이벤트
 */
@Getter
@Builder
@ToString
public class InboundEvent {

    private final EventType type;
    private final long updateId; // 플랫폼 업데이트 ID
    private final Long chatId;
    private final Long userId;
    private final String username;
    private final String firstName;
    private final String text; // TEXT 본문

    // COMMAND
    private final String command; // "/" 와 "@봇이름" 을 제외한 명령 이름
    @Singular
    private final List<String> args;

    // PHOTO
    private final String photoFileId; // 가장 큰 해상도의 파일 ID
    private final long photoFileSize;
    private final String caption;

    // CALLBACK
    private final String callbackId;
    private final String callbackData;

    public String argsAsText() {
        return String.join(" ", args);
    }
}
