package com.example.geminibot.bot;

import com.example.geminibot.client.GenerativeAiException;
import com.example.geminibot.config.BotProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * AI 백엔드 호출을 별도 스레드에서 실행하고 최대 대기 시간을 강제한다.
 * 시간 초과, 인터럽트, 호출 실패는 모두 {@link GenerativeAiException} 으로 전달된다.
 */
@Slf4j
@Component
public class BackendCallExecutor implements DisposableBean {

    private final ExecutorService executor;
    private final Duration timeout;

    @Autowired
    public BackendCallExecutor(BotProperties properties) {
        this(properties.getGemini().getTimeout());
    }

    BackendCallExecutor(Duration timeout) {
        this.timeout = timeout;
        AtomicInteger threadNumber = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "ai-backend-" + threadNumber.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public <T> T call(String operation, Supplier<T> supplier) {
        // Future.cancel(true) 는 실행 중인 호출 스레드를 인터럽트함
        Callable<T> task = supplier::get;
        Future<T> future = executor.submit(task);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("AI backend call '{}' timed out after {}ms", operation, timeout.toMillis());
            throw new GenerativeAiException(operation + " timed out after " + timeout.toSeconds() + "s", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new GenerativeAiException(operation + " interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof GenerativeAiException aiException) {
                throw aiException;
            }
            throw new GenerativeAiException(operation + " failed: " + cause.getMessage(), cause);
        }
    }

    @Override
    public void destroy() {
        executor.shutdownNow();
    }
}
