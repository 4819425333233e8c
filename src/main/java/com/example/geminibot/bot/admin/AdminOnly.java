package com.example.geminibot.bot.admin;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 관리자 전용 명령 어노테이션
 * 메서드 인자 중 {@link com.example.geminibot.bot.InboundEvent} 의 userId 가 관리자 ID 와 일치해야 호출된다.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface AdminOnly {

    /**
     * 로그에 남길 명령 이름
     */
    String value() default "";
}
