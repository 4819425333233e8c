package com.example.geminibot.coordinator;

import com.example.geminibot.context.ConversationContextStore;
import com.example.geminibot.context.ConversationTurn;
import com.example.geminibot.context.TurnRole;
import com.example.geminibot.ratelimiter.algorithm.SlidingWindowLogRateLimiter;
import com.example.geminibot.stats.StatsCounter;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
@DisplayName("상태 코디네이터 테스트")
class StateCoordinatorTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private SlidingWindowLogRateLimiter rateLimiter;
    private StateCoordinator coordinator;

    @BeforeEach
    void setUp() {
        rateLimiter = new SlidingWindowLogRateLimiter(2, 60);
        coordinator = new StateCoordinator(rateLimiter, new ConversationContextStore(20),
                new StatsCounter(T0), Clock.fixed(T0, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("허용된 메시지 - 사용자 턴 추가, 처리 수 증가, 새 턴을 포함한 컨텍스트 반환")
    void testAdmittedMessage() {
        MessageAdmission admission = coordinator.tryHandleMessage(1L, "hello", T0);

        assertTrue(admission.isAdmitted());
        assertEquals(1, admission.getRemainingRequests());
        assertEquals(1, admission.getContext().size());
        assertEquals(TurnRole.USER, admission.getContext().get(0).getRole());
        assertEquals(1, coordinator.statusSnapshot(T0).getMessagesProcessed());
        assertEquals(1, coordinator.statusSnapshot(T0).getActiveUsers());
    }

    @Test
    @DisplayName("거부된 메시지 - 컨텍스트와 카운터를 변경하지 않음")
    void testRateLimitedMessageDoesNotMutate() {
        coordinator.tryHandleMessage(1L, "a", T0);
        coordinator.tryHandleMessage(1L, "b", T0.plusSeconds(1));

        MessageAdmission admission = coordinator.tryHandleMessage(1L, "c", T0.plusSeconds(2));

        assertTrue(admission.isRateLimited());
        assertTrue(admission.getContext().isEmpty());
        assertEquals(59, admission.getRetryAfterSeconds());
        assertEquals(2, coordinator.conversationSnapshot(1L).size(), "거부된 메시지는 추가되지 않아야 합니다");

        StatusSnapshot snapshot = coordinator.statusSnapshot(T0.plusSeconds(2));
        assertEquals(2, snapshot.getMessagesProcessed());
        assertEquals(0, snapshot.getErrors(), "Rate Limit 거부는 에러가 아닙니다");
    }

    @Test
    @DisplayName("사용자 턴 뒤 응답 턴 - 추가 순서대로 조회")
    void testTurnOrdering() {
        coordinator.tryHandleMessage(1L, "question", T0);
        coordinator.recordAssistantTurn(1L, "answer", T0.plusSeconds(1));

        List<ConversationTurn> turns = coordinator.conversationSnapshot(1L);

        assertEquals(List.of(TurnRole.USER, TurnRole.ASSISTANT), turns.stream().map(ConversationTurn::getRole).toList());
        assertEquals("answer", turns.get(1).getText());
    }

    @Test
    @DisplayName("대화 초기화 직후 스냅샷은 비어 있음 (Rate Limit 기록은 유지)")
    void testResetConversation() {
        coordinator.tryHandleMessage(1L, "a", T0);
        coordinator.recordAssistantTurn(1L, "b", T0);

        coordinator.resetConversation(1L);

        assertTrue(coordinator.conversationSnapshot(1L).isEmpty());
        assertEquals(1, rateLimiter.getRequestCount(1L), "초기화는 Rate Limit 기록에 영향을 주지 않아야 합니다");
        assertTrue(coordinator.conversationSnapshot(77L).isEmpty(), "모르는 사용자도 빈 컨텍스트여야 합니다");
    }

    @Test
    @DisplayName("이미지 이벤트와 에러 기록")
    void testImageEventsAndErrors() {
        coordinator.recordImageEvent(ImageEventKind.ANALYZED);
        coordinator.recordImageEvent(ImageEventKind.GENERATED);
        coordinator.recordImageEvent(ImageEventKind.GENERATED);
        coordinator.recordError();

        StatusSnapshot snapshot = coordinator.statusSnapshot(T0.plusSeconds(90_061));

        assertEquals(1, snapshot.getImagesAnalyzed());
        assertEquals(2, snapshot.getImagesGenerated());
        assertEquals(1, snapshot.getErrors());
        assertEquals(3, snapshot.getTotalImagesProcessed());
        assertEquals("1d 1h 1m", snapshot.getUptimeFormatted());
        assertThrows(IllegalArgumentException.class, () -> coordinator.recordImageEvent(null));
    }

    @Test
    @DisplayName("유휴 정리 - 유휴 시간이 설정된 경우에만 컨텍스트 제거")
    void testEvictIdle() {
        StateCoordinator withIdleTimeout = new StateCoordinator(new SlidingWindowLogRateLimiter(10, 60),
                new ConversationContextStore(20), new StatsCounter(T0), Clock.fixed(T0, ZoneOffset.UTC),
                Duration.ofMinutes(30));
        withIdleTimeout.tryHandleMessage(1L, "a", T0);
        coordinator.tryHandleMessage(1L, "a", T0);

        withIdleTimeout.evictIdle(T0.plus(Duration.ofHours(1)));
        coordinator.evictIdle(T0.plus(Duration.ofHours(1)));

        assertTrue(withIdleTimeout.conversationSnapshot(1L).isEmpty(), "유휴 컨텍스트는 제거되어야 합니다");
        assertEquals(1, coordinator.conversationSnapshot(1L).size(), "유휴 시간 미설정 시 컨텍스트는 유지되어야 합니다");
        assertEquals(0, rateLimiter.getRequestCount(1L), "비활성 Rate Limit 기록은 항상 정리되어야 합니다");
    }

    @Test
    @DisplayName("동시 처리 - messages_processed 는 허용된 호출 수와 정확히 일치")
    void testConcurrentMessagesProcessed() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> futures = new ArrayList<>();

        for (long user = 1; user <= 10; user++) {
            for (int i = 0; i < 5; i++) {
                long userId = user;
                futures.add(executor.submit(() -> {
                    start.await();
                    return coordinator.tryHandleMessage(userId, "msg", T0).isAdmitted();
                }));
            }
        }
        start.countDown();

        long admitted = 0;
        for (Future<Boolean> future : futures) {
            if (future.get(10, TimeUnit.SECONDS)) {
                admitted++;
            }
        }
        executor.shutdown();

        StatusSnapshot snapshot = coordinator.statusSnapshot(T0);
        assertEquals(20, admitted, "사용자당 2건씩만 허용되어야 합니다");
        assertEquals(admitted, snapshot.getMessagesProcessed());
        assertEquals(admitted, snapshot.getContextSizeTotal());
    }

    @Test
    @DisplayName("처리 중 동시 상태 조회 - 카운터와 컨텍스트가 항상 같은 시점의 값")
    void testStatusSnapshotIsNeverTorn() throws Exception {
        StateCoordinator unlimited = new StateCoordinator(new SlidingWindowLogRateLimiter(1_000, 60),
                new ConversationContextStore(20), new StatsCounter(T0), Clock.fixed(T0, ZoneOffset.UTC));
        ExecutorService executor = Executors.newFixedThreadPool(4);
        AtomicBoolean torn = new AtomicBoolean(false);
        AtomicBoolean writing = new AtomicBoolean(true);

        Future<?> writer = executor.submit(() -> {
            for (long user = 1; user <= 2_000; user++) {
                unlimited.tryHandleMessage(user, "msg", T0);
            }
            writing.set(false);
        });

        List<Future<?>> readers = new ArrayList<>();
        for (int r = 0; r < 2; r++) {
            readers.add(executor.submit(() -> {
                while (writing.get()) {
                    StatusSnapshot snapshot = unlimited.statusSnapshot(T0);
                    // 사용자마다 메시지 1건씩이므로 세 값은 항상 같아야 함
                    if (snapshot.getMessagesProcessed() != snapshot.getContextSizeTotal()
                            || snapshot.getMessagesProcessed() != snapshot.getActiveUsers()) {
                        torn.set(true);
                    }
                }
            }));
        }

        writer.get(30, TimeUnit.SECONDS);
        for (Future<?> reader : readers) {
            reader.get(30, TimeUnit.SECONDS);
        }
        executor.shutdown();

        assertFalse(torn.get(), "상태 스냅샷이 부분적으로 갱신된 값을 관찰하면 안 됩니다");
        assertEquals(2_000, unlimited.statusSnapshot(T0).getMessagesProcessed());
    }

    @Test
    @DisplayName("관리자용 상위 사용자와 Rate Limit 상태 조회, 가용성 확인")
    void testTopUsersAndAvailability() {
        coordinator.tryHandleMessage(1L, "a", T0);
        coordinator.tryHandleMessage(2L, "a", T0);
        coordinator.recordAssistantTurn(2L, "b", T0);

        assertEquals(List.of(2L, 1L), List.copyOf(coordinator.topUsers(10).keySet()));
        assertEquals(1, coordinator.rateLimitStats(1L).get("remainingRequests"));
        assertTrue(coordinator.isAvailable());
        assertEquals(T0, coordinator.getStartTime());
    }
}
