package com.example.geminibot.coordinator;

import com.example.geminibot.context.ConversationTurn;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * 메시지 처리 요청의 결과: Admitted 또는 RateLimited
 *
 * Rate Limit 거부는 예외가 아니라 정상적인 반환값으로 표현한다.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class MessageAdmission {

    public enum Outcome {
        ADMITTED,
        RATE_LIMITED
    }

    private final Outcome outcome;
    private final List<ConversationTurn> context; // 허용 시 새 사용자 턴까지 포함한 컨텍스트
    private final long remainingRequests;
    private final long retryAfterSeconds;

    public static MessageAdmission admitted(List<ConversationTurn> context, long remainingRequests) {
        return new MessageAdmission(Outcome.ADMITTED, List.copyOf(context), remainingRequests, 0);
    }

    public static MessageAdmission rateLimited(long retryAfterSeconds) {
        return new MessageAdmission(Outcome.RATE_LIMITED, List.of(), 0, retryAfterSeconds);
    }

    public boolean isAdmitted() {
        return outcome == Outcome.ADMITTED;
    }

    public boolean isRateLimited() {
        return outcome == Outcome.RATE_LIMITED;
    }
}
