package com.example.geminibot.context;

import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 사용자별 대화 컨텍스트 저장소
 *
 * 사용자마다 최대 maxTurns 개의 턴을 보관하며, 초과 시 가장 오래된 턴부터 제거(FIFO)한다.
 * 내부 맵은 외부로 노출하지 않고 항상 복사본만 반환한다.
 */
@Slf4j
public class ConversationContextStore {

    public static final int DEFAULT_MAX_TURNS = 20;

    private final int maxTurns;
    private final Map<Long, Deque<ConversationTurn>> contexts = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final ReentrantReadWriteLock.ReadLock readLock = lock.readLock();
    private final ReentrantReadWriteLock.WriteLock writeLock = lock.writeLock();

    public ConversationContextStore() {
        this(DEFAULT_MAX_TURNS);
    }

    public ConversationContextStore(int maxTurns) {
        if (maxTurns <= 0) {
            throw new IllegalArgumentException("Max turns must be positive");
        }
        this.maxTurns = maxTurns;
    }

    public void append(Long userId, ConversationTurn turn) {
        if (userId == null || turn == null) {
            throw new IllegalArgumentException("userId and turn must not be null");
        }

        writeLock.lock();
        try {
            Deque<ConversationTurn> turns = contexts.computeIfAbsent(userId, id -> new ArrayDeque<>());
            turns.addLast(turn);
            while (turns.size() > maxTurns) {
                turns.pollFirst();
            }
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * 현재 컨텍스트의 읽기 전용 복사본. 모르는 사용자는 빈 리스트
     */
    public List<ConversationTurn> snapshot(Long userId) {
        readLock.lock();
        try {
            Deque<ConversationTurn> turns = contexts.get(userId);
            if (turns == null) {
                return List.of();
            }
            return List.copyOf(turns);
        } finally {
            readLock.unlock();
        }
    }

    public void clear(Long userId) {
        writeLock.lock();
        try {
            Deque<ConversationTurn> removed = contexts.remove(userId);
            if (removed != null) {
                log.debug("Cleared {} turns for user: {}", removed.size(), userId);
            }
        } finally {
            writeLock.unlock();
        }
    }

    public int activeUserCount() {
        readLock.lock();
        try {
            return contexts.size();
        } finally {
            readLock.unlock();
        }
    }

    public int totalTurnCount() {
        readLock.lock();
        try {
            int total = 0;
            for (Deque<ConversationTurn> turns : contexts.values()) {
                total += turns.size();
            }
            return total;
        } finally {
            readLock.unlock();
        }
    }

    /**
     * 턴 수가 많은 순으로 상위 사용자 (userId -> 턴 수), 순서 보존
     */
    public Map<Long, Integer> topUsersByTurnCount(int limit) {
        List<Map.Entry<Long, Integer>> counts = new ArrayList<>();
        readLock.lock();
        try {
            for (Map.Entry<Long, Deque<ConversationTurn>> entry : contexts.entrySet()) {
                counts.add(Map.entry(entry.getKey(), entry.getValue().size()));
            }
        } finally {
            readLock.unlock();
        }

        counts.sort(Map.Entry.<Long, Integer>comparingByValue(Comparator.reverseOrder())
                .thenComparing(Map.Entry.<Long, Integer>comparingByKey()));

        Map<Long, Integer> top = new LinkedHashMap<>();
        for (Map.Entry<Long, Integer> entry : counts.subList(0, Math.min(limit, counts.size()))) {
            top.put(entry.getKey(), entry.getValue());
        }
        return Collections.unmodifiableMap(top);
    }

    /**
     * 마지막 턴이 cutoff 이전인 사용자 컨텍스트 제거
     *
     * @return 제거된 사용자 수
     */
    public int evictIdle(Instant cutoff) {
        int removed = 0;
        writeLock.lock();
        try {
            Iterator<Map.Entry<Long, Deque<ConversationTurn>>> it = contexts.entrySet().iterator();
            while (it.hasNext()) {
                ConversationTurn newest = it.next().getValue().peekLast();
                if (newest == null || newest.getTimestamp().isBefore(cutoff)) {
                    it.remove();
                    removed++;
                }
            }
        } finally {
            writeLock.unlock();
        }

        if (removed > 0) {
            log.info("Evicted {} idle conversation contexts", removed);
        }
        return removed;
    }

    public int getMaxTurns() {
        return maxTurns;
    }
}
