package com.example.geminibot.bot.admin;

import com.example.geminibot.bot.InboundEvent;
import com.example.geminibot.config.BotProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.stereotype.Component;

/**
 * Admin AOP Aspect
 * {@link AdminOnly} 가 적용된 메서드 호출 전에 관리자 권한을 검사합니다.
 * 코디네이터는 권한을 알지 못하므로 권한 검사는 항상 이 단계에서 끝나야 합니다.
 */
@Slf4j
@Aspect
@Component
@RequiredArgsConstructor
public class AdminAccessAspect {

    private final BotProperties properties;

    @Around("@annotation(adminOnly)")
    public Object around(ProceedingJoinPoint joinPoint, AdminOnly adminOnly) throws Throwable {
        InboundEvent event = findEvent(joinPoint.getArgs());
        String action = adminOnly.value().isEmpty() ? joinPoint.getSignature().getName() : adminOnly.value();

        if (event == null) {
            throw new IllegalStateException("@AdminOnly method " + action + " has no InboundEvent argument");
        }

        if (!properties.isAdmin(event.getUserId())) {
            log.warn("Admin access denied - user: {}, action: {}", event.getUserId(), action);
            throw new AdminAccessDeniedException(event.getUserId(), action);
        }

        return joinPoint.proceed();
    }

    private InboundEvent findEvent(Object[] args) {
        for (Object arg : args) {
            if (arg instanceof InboundEvent event) {
                return event;
            }
        }
        return null;
    }
}
