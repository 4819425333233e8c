package com.example.geminibot.coordinator;

import com.example.geminibot.context.ConversationContextStore;
import com.example.geminibot.context.ConversationTurn;
import com.example.geminibot.ratelimiter.core.RateLimitDecision;
import com.example.geminibot.ratelimiter.core.RateLimiter;
import com.example.geminibot.stats.StatCounter;
import com.example.geminibot.stats.StatsCounter;
import com.example.geminibot.stats.StatsSnapshot;
import com.example.geminibot.util.TimeUtil;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 처리 루프와 상태 서버가 공유 상태에 접근하는 유일한 진입점
 *
 * Rate Limiter, 대화 컨텍스트, 사용량 카운터는 각각 자체적으로 스레드 안전하다.
 * 여기서는 여러 구조를 함께 건드리는 단계(턴 추가 + 카운터 증가, 카운터 + 활성 사용자 수 조회)만
 * stateLock 으로 묶는다. 이 락을 잡은 채로 외부 I/O 를 호출해서는 안 된다.
 */
@Slf4j
public class StateCoordinator {

    private static final long AVAILABILITY_TIMEOUT_MILLIS = 1000;

    private final RateLimiter rateLimiter;
    private final ConversationContextStore contextStore;
    private final StatsCounter statsCounter;
    private final Clock clock;
    private final Duration contextIdleTimeout; // null 또는 0 이면 컨텍스트 유휴 정리 비활성
    private final ReentrantLock stateLock = new ReentrantLock();

    public StateCoordinator(RateLimiter rateLimiter,
                            ConversationContextStore contextStore,
                            StatsCounter statsCounter,
                            Clock clock,
                            Duration contextIdleTimeout) {
        this.rateLimiter = rateLimiter;
        this.contextStore = contextStore;
        this.statsCounter = statsCounter;
        this.clock = clock;
        this.contextIdleTimeout = contextIdleTimeout;
    }

    public StateCoordinator(RateLimiter rateLimiter,
                            ConversationContextStore contextStore,
                            StatsCounter statsCounter,
                            Clock clock) {
        this(rateLimiter, contextStore, statsCounter, clock, null);
    }

    public MessageAdmission tryHandleMessage(Long userId, String text) {
        return tryHandleMessage(userId, text, clock.instant());
    }

    /**
     * 허용되면 사용자 턴을 추가하고 messages_processed 를 증가시킨 뒤 컨텍스트 스냅샷을 반환한다.
     * 거부되면 컨텍스트와 카운터를 건드리지 않는다.
     */
    public MessageAdmission tryHandleMessage(Long userId, String text, Instant now) {
        RateLimitDecision result = rateLimiter.allowRequest(userId, now.toEpochMilli());
        if (!result.isAllowed()) {
            log.debug("Message rate limited for user: {} ({} in window), retry after: {}s",
                    userId, result.getRequestsInWindow(), result.getRetryAfterSeconds());
            return MessageAdmission.rateLimited(result.getRetryAfterSeconds());
        }

        List<ConversationTurn> context;
        stateLock.lock();
        try {
            contextStore.append(userId, ConversationTurn.user(text, now));
            statsCounter.increment(StatCounter.MESSAGES_PROCESSED);
            context = contextStore.snapshot(userId);
        } finally {
            stateLock.unlock();
        }

        return MessageAdmission.admitted(context, result.getRemainingRequests());
    }

    public MessageAdmission tryAdmit(Long userId) {
        return tryAdmit(userId, clock.instant());
    }

    /**
     * 대화 컨텍스트와 무관한 요청(이미지 생성/분석)의 허용 여부만 판정
     */
    public MessageAdmission tryAdmit(Long userId, Instant now) {
        RateLimitDecision result = rateLimiter.allowRequest(userId, now.toEpochMilli());
        if (!result.isAllowed()) {
            return MessageAdmission.rateLimited(result.getRetryAfterSeconds());
        }
        return MessageAdmission.admitted(List.of(), result.getRemainingRequests());
    }

    public void recordAssistantTurn(Long userId, String text) {
        recordAssistantTurn(userId, text, clock.instant());
    }

    public void recordAssistantTurn(Long userId, String text, Instant now) {
        stateLock.lock();
        try {
            contextStore.append(userId, ConversationTurn.assistant(text, now));
        } finally {
            stateLock.unlock();
        }
    }

    public void recordImageEvent(ImageEventKind kind) {
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
        statsCounter.increment(kind.getCounter());
    }

    public void recordError() {
        statsCounter.increment(StatCounter.ERRORS);
    }

    public void resetConversation(Long userId) {
        stateLock.lock();
        try {
            contextStore.clear(userId);
        } finally {
            stateLock.unlock();
        }
        log.debug("Conversation reset for user: {}", userId);
    }

    public List<ConversationTurn> conversationSnapshot(Long userId) {
        return contextStore.snapshot(userId);
    }

    public StatusSnapshot statusSnapshot() {
        return statusSnapshot(clock.instant());
    }

    public StatusSnapshot statusSnapshot(Instant now) {
        StatsSnapshot stats;
        int activeUsers;
        int contextSizeTotal;

        stateLock.lock();
        try {
            stats = statsCounter.snapshot(now);
            activeUsers = contextStore.activeUserCount();
            contextSizeTotal = contextStore.totalTurnCount();
        } finally {
            stateLock.unlock();
        }

        return StatusSnapshot.builder()
                .uptimeSeconds(stats.getUptimeSeconds())
                .uptimeFormatted(TimeUtil.formatUptime(Duration.ofSeconds(stats.getUptimeSeconds())))
                .messagesProcessed(stats.getMessagesProcessed())
                .imagesAnalyzed(stats.getImagesAnalyzed())
                .imagesGenerated(stats.getImagesGenerated())
                .errors(stats.getErrors())
                .activeUsers(activeUsers)
                .contextSizeTotal(contextSizeTotal)
                .startTime(stats.getStartTime())
                .timestamp(now)
                .build();
    }

    public Map<Long, Integer> topUsers(int limit) {
        return contextStore.topUsersByTurnCount(limit);
    }

    public Map<String, Object> rateLimitStats(Long userId) {
        return rateLimiter.getStats(userId);
    }

    /**
     * 상태 서버의 헬스 체크용. 제한 시간 안에 락을 얻을 수 있으면 응답 가능한 상태로 본다.
     */
    public boolean isAvailable() {
        try {
            if (stateLock.tryLock(AVAILABILITY_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS)) {
                stateLock.unlock();
                return true;
            }
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public void evictIdle() {
        evictIdle(clock.instant());
    }

    /**
     * 비활성 사용자 정리. Rate Limit 로그는 항상, 대화 컨텍스트는 유휴 시간이 설정된 경우에만 정리
     */
    public void evictIdle(Instant now) {
        int removedLogs = rateLimiter.cleanupInactiveLogs(now.toEpochMilli());
        int removedContexts = 0;
        if (contextIdleTimeout != null && !contextIdleTimeout.isZero() && !contextIdleTimeout.isNegative()) {
            stateLock.lock();
            try {
                removedContexts = contextStore.evictIdle(now.minus(contextIdleTimeout));
            } finally {
                stateLock.unlock();
            }
        }
        log.debug("Idle eviction finished - rate limit logs: {}, contexts: {}", removedLogs, removedContexts);
    }

    public Instant getStartTime() {
        return statsCounter.getStartTime();
    }
}
