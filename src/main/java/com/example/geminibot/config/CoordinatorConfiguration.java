package com.example.geminibot.config;

import com.example.geminibot.context.ConversationContextStore;
import com.example.geminibot.coordinator.StateCoordinator;
import com.example.geminibot.ratelimiter.algorithm.SlidingWindowLogRateLimiter;
import com.example.geminibot.ratelimiter.core.RateLimiter;
import com.example.geminibot.stats.StatsCounter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 공유 상태 코디네이터와 그 구성 요소 Bean 등록
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class CoordinatorConfiguration {

    private final BotProperties properties;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RateLimiter messageRateLimiter() {
        BotProperties.RateLimit config = properties.getRateLimit();
        return new SlidingWindowLogRateLimiter(config.getLimit(), config.getWindowSeconds());
    }

    @Bean
    public StateCoordinator stateCoordinator(RateLimiter messageRateLimiter, Clock clock) {
        ConversationContextStore contextStore = new ConversationContextStore(properties.getContext().getMaxTurns());
        StatsCounter statsCounter = new StatsCounter(clock.instant());

        log.info("StateCoordinator created - rate limit: {}/{}s, context max turns: {}, context idle timeout: {}",
                properties.getRateLimit().getLimit(), properties.getRateLimit().getWindowSeconds(),
                properties.getContext().getMaxTurns(), properties.getContext().getIdleTimeout());

        return new StateCoordinator(messageRateLimiter, contextStore, statsCounter, clock,
                properties.getContext().getIdleTimeout());
    }
}
