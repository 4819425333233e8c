package com.example.geminibot.config;

import com.example.geminibot.coordinator.StateCoordinator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 비활성 사용자의 Rate Limit 로그와 (설정 시) 대화 컨텍스트를 주기적으로 정리
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IdleEvictionScheduler {

    private final StateCoordinator stateCoordinator;

    @Scheduled(fixedDelayString = "${bot.rate-limit.cleanup-interval:PT5M}",
            initialDelayString = "${bot.rate-limit.cleanup-interval:PT5M}")
    public void evictIdleUsers() {
        try {
            stateCoordinator.evictIdle();
        } catch (RuntimeException e) {
            log.error("Idle eviction failed", e);
        }
    }
}
