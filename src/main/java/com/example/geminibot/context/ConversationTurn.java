package com.example.geminibot.context;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * 대화 한 턴 (역할 + 본문 + 시각). 불변 객체
 */
@Getter
@Builder
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class ConversationTurn {

    private final TurnRole role;
    private final String text;
    private final Instant timestamp;

    public static ConversationTurn user(String text, Instant timestamp) {
        return new ConversationTurn(TurnRole.USER, text, timestamp);
    }

    public static ConversationTurn assistant(String text, Instant timestamp) {
        return new ConversationTurn(TurnRole.ASSISTANT, text, timestamp);
    }
}
