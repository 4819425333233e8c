package com.example.geminibot.bot;

import com.example.geminibot.bot.admin.AdminAccessDeniedException;
import com.example.geminibot.client.ChatPlatformClient;
import com.example.geminibot.client.ChatPlatformException;
import com.example.geminibot.coordinator.StateCoordinator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * 사용자 이벤트를 도착 순서대로 하나씩 처리하는 단일 스레드 루프
 *
 * 이벤트 하나의 실패가 루프를 멈추지 않도록 이벤트 단위로 예외를 처리한다.
 */
@Slf4j
@Component
public class InboundProcessingLoop implements DisposableBean {

    private final BotCommandHandler handler;
    private final ChatPlatformClient platform;
    private final StateCoordinator coordinator;
    private final ExecutorService worker;

    public InboundProcessingLoop(BotCommandHandler handler, ChatPlatformClient platform, StateCoordinator coordinator) {
        this.handler = handler;
        this.platform = platform;
        this.coordinator = coordinator;
        this.worker = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "bot-processing-loop");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * 이벤트를 처리 큐에 추가
     *
     * @return 큐에 들어갔으면 true, 루프가 종료된 상태면 false
     */
    public boolean submit(InboundEvent event) {
        try {
            worker.execute(() -> process(event));
            return true;
        } catch (RejectedExecutionException e) {
            log.warn("Processing loop is shut down, dropping update {}", event.getUpdateId());
            return false;
        }
    }

    void process(InboundEvent event) {
        try {
            dispatch(event);
        } catch (AdminAccessDeniedException e) {
            reply(event, BotMessages.ACCESS_DENIED);
        } catch (RuntimeException e) {
            log.error("Unhandled error while processing update {} from user {}",
                    event.getUpdateId(), event.getUserId(), e);
            coordinator.recordError();
            reply(event, BotMessages.GENERIC_FAILURE);
        }
    }

    private void dispatch(InboundEvent event) {
        switch (event.getType()) {
            case COMMAND -> dispatchCommand(event);
            case TEXT -> handler.handleText(event);
            case PHOTO -> handler.handlePhoto(event);
            case CALLBACK -> handler.handleAdminCallback(event);
        }
    }

    private void dispatchCommand(InboundEvent event) {
        switch (event.getCommand()) {
            case "start" -> handler.handleStart(event);
            case "help" -> handler.handleHelp(event);
            case "generate" -> handler.handleGenerate(event);
            case "status" -> handler.handleStatus(event);
            case "clear" -> handler.handleClear(event);
            case "admin" -> handler.handleAdmin(event);
            case "stats" -> handler.handleStats(event);
            default -> handler.handleUnknownCommand(event);
        }
    }

    private void reply(InboundEvent event, String text) {
        try {
            platform.sendMessage(event.getChatId(), text);
        } catch (ChatPlatformException e) {
            log.warn("Failed to reply to chat {}: {}", event.getChatId(), e.getMessage());
        }
    }

    @Override
    public void destroy() throws InterruptedException {
        worker.shutdown();
        if (!worker.awaitTermination(5, TimeUnit.SECONDS)) {
            log.warn("Processing loop did not finish pending events, forcing shutdown");
            worker.shutdownNow();
        }
    }
}
