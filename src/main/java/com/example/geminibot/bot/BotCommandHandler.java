package com.example.geminibot.bot;

import com.example.geminibot.bot.admin.AdminControls;
import com.example.geminibot.bot.admin.AdminOnly;
import com.example.geminibot.client.ChatPlatformClient;
import com.example.geminibot.client.ChatPlatformException;
import com.example.geminibot.client.GeneratedImage;
import com.example.geminibot.client.GenerativeAiClient;
import com.example.geminibot.client.GenerativeAiException;
import com.example.geminibot.client.ParseMode;
import com.example.geminibot.config.BotProperties;
import com.example.geminibot.context.ConversationTurn;
import com.example.geminibot.coordinator.ImageEventKind;
import com.example.geminibot.coordinator.MessageAdmission;
import com.example.geminibot.coordinator.StateCoordinator;
import com.example.geminibot.coordinator.StatusSnapshot;
import com.example.geminibot.util.MessageFormatUtil;
import com.example.geminibot.util.TimeUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 플랫폼 명령/메시지별 처리
 *
 * 공유 상태는 전부 {@link StateCoordinator} 를 통해서만 접근하며,
 * AI 호출은 {@link BackendCallExecutor} 로 시간 제한을 건 뒤 코디네이터 락 밖에서 수행한다.
 * 백엔드 실패 시 recordError() 를 호출하고 사용자 턴은 그대로 남긴다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BotCommandHandler {

    private static final int MAX_CAPTION_LENGTH = 1024;

    private final StateCoordinator coordinator;
    private final ChatPlatformClient platform;
    private final GenerativeAiClient aiClient;
    private final BackendCallExecutor backend;
    private final AdminControls adminControls;
    private final BotProperties properties;

    public void handleStart(InboundEvent event) {
        String name = event.getFirstName() != null ? event.getFirstName() : "there";
        String welcome = String.format(BotMessages.WELCOME, name);
        if (properties.isAdmin(event.getUserId())) {
            welcome += BotMessages.WELCOME_ADMIN;
        }
        platform.sendMessage(event.getChatId(), welcome);
    }

    public void handleHelp(InboundEvent event) {
        platform.sendMessage(event.getChatId(), BotMessages.HELP);
    }

    public void handleStatus(InboundEvent event) {
        StatusSnapshot snapshot = coordinator.statusSnapshot();
        String status = "🤖 Bot Status\n\n"
                + "✅ Status: Online\n"
                + "⏰ Uptime: " + snapshot.getUptimeFormatted() + "\n"
                + "📊 Messages: " + snapshot.getMessagesProcessed() + "\n"
                + "🖼️ Images Analyzed: " + snapshot.getImagesAnalyzed() + "\n"
                + "🎨 Images Generated: " + snapshot.getImagesGenerated() + "\n"
                + "❌ Errors: " + snapshot.getErrors() + "\n"
                + "🚀 Started: " + TimeUtil.formatTimestamp(snapshot.getStartTime());
        platform.sendMessage(event.getChatId(), status);
    }

    public void handleClear(InboundEvent event) {
        coordinator.resetConversation(event.getUserId());
        logUserAction(event, "clear", "");
        platform.sendMessage(event.getChatId(), BotMessages.CONTEXT_CLEARED);
    }

    public void handleText(InboundEvent event) {
        MessageAdmission admission = coordinator.tryHandleMessage(event.getUserId(), event.getText());
        if (admission.isRateLimited()) {
            platform.sendMessage(event.getChatId(), BotMessages.RATE_LIMITED);
            return;
        }
        logUserAction(event, "message", MessageFormatUtil.truncateText(event.getText(), 50));

        try {
            List<ConversationTurn> context = admission.getContext();
            // 컨텍스트에 새 턴만 있으면 단일 프롬프트 호출
            String response = context.size() > 1
                    ? backend.call("chat with context", () -> aiClient.chatWithContext(context))
                    : backend.call("generate response", () -> aiClient.generateResponse(event.getText()));

            coordinator.recordAssistantTurn(event.getUserId(), response);
            platform.sendMessage(event.getChatId(),
                    MessageFormatUtil.formatMessage(response, properties.getMaxMessageLength()),
                    ParseMode.MARKDOWN_V2);
        } catch (GenerativeAiException | ChatPlatformException e) {
            log.error("Error handling message from user {}: {}", event.getUserId(), e.getMessage());
            coordinator.recordError();
            replyQuietly(event, BotMessages.GENERIC_FAILURE);
        }
    }

    public void handleGenerate(InboundEvent event) {
        MessageAdmission admission = coordinator.tryAdmit(event.getUserId());
        if (admission.isRateLimited()) {
            platform.sendMessage(event.getChatId(), BotMessages.RATE_LIMITED);
            return;
        }

        String prompt = event.argsAsText().trim();
        if (prompt.isEmpty()) {
            platform.sendMessage(event.getChatId(), BotMessages.GENERATE_USAGE);
            return;
        }
        logUserAction(event, "generate", MessageFormatUtil.truncateText(prompt, 50));

        try {
            platform.sendMessage(event.getChatId(), BotMessages.GENERATING);
            GeneratedImage image = backend.call("generate image", () -> aiClient.generateImage(prompt));

            String caption = "🎨 Generated Image\n\nPrompt: " + prompt + "\n\n" + image.getDescription();
            platform.sendPhoto(event.getChatId(), image.getData(),
                    MessageFormatUtil.truncateText(caption, MAX_CAPTION_LENGTH));
            coordinator.recordImageEvent(ImageEventKind.GENERATED);
        } catch (GenerativeAiException | ChatPlatformException e) {
            log.error("Error generating image for user {}: {}", event.getUserId(), e.getMessage());
            coordinator.recordError();
            replyQuietly(event, "❌ Failed to generate image. Please try again later.");
        }
    }

    public void handlePhoto(InboundEvent event) {
        MessageAdmission admission = coordinator.tryAdmit(event.getUserId());
        if (admission.isRateLimited()) {
            platform.sendMessage(event.getChatId(), BotMessages.RATE_LIMITED);
            return;
        }

        if (event.getPhotoFileSize() > properties.getMaxImageSize()) {
            long maxMb = properties.getMaxImageSize() / (1024 * 1024);
            platform.sendMessage(event.getChatId(), String.format(BotMessages.IMAGE_TOO_LARGE, maxMb));
            return;
        }
        logUserAction(event, "photo", event.getCaption() != null ? event.getCaption() : "");

        String caption = event.getCaption();
        String prompt = caption != null && !caption.isBlank()
                ? "User caption: " + caption + "\n\nPlease analyze this image."
                : "";

        try {
            platform.sendMessage(event.getChatId(), BotMessages.ANALYZING);
            byte[] image = platform.downloadFile(event.getPhotoFileId());
            String analysis = backend.call("analyze image", () -> aiClient.analyzeImage(image, prompt));

            String text = "🔍 Image Analysis\n\n" + analysis;
            if (caption != null && !caption.isBlank()) {
                text = "📝 Your caption: " + caption + "\n\n" + text;
            }
            platform.sendMessage(event.getChatId(),
                    MessageFormatUtil.formatMessage(text, properties.getMaxMessageLength()),
                    ParseMode.MARKDOWN_V2);
            coordinator.recordImageEvent(ImageEventKind.ANALYZED);
        } catch (GenerativeAiException | ChatPlatformException e) {
            log.error("Error analyzing photo from user {}: {}", event.getUserId(), e.getMessage());
            coordinator.recordError();
            replyQuietly(event, "❌ Error analyzing image. Please try again later.");
        }
    }

    @AdminOnly("admin")
    public void handleAdmin(InboundEvent event) {
        platform.sendMenu(event.getChatId(), adminControls.panelText(), adminControls.panelButtons());
    }

    @AdminOnly("stats")
    public void handleStats(InboundEvent event) {
        platform.sendMessage(event.getChatId(), adminControls.detailedStats(coordinator.statusSnapshot()));
    }

    @AdminOnly("admin callback")
    public void handleAdminCallback(InboundEvent event) {
        if (event.getCallbackId() != null) {
            platform.answerCallback(event.getCallbackId());
        }

        String data = event.getCallbackData() != null ? event.getCallbackData() : "";
        switch (data) {
            case AdminControls.CALLBACK_BACK ->
                    platform.sendMenu(event.getChatId(), adminControls.panelText(), adminControls.panelButtons());
            case AdminControls.CALLBACK_STATS ->
                    platform.sendMenu(event.getChatId(), adminControls.detailedStats(coordinator.statusSnapshot()),
                            adminControls.backButton());
            case AdminControls.CALLBACK_USERS -> {
                StatusSnapshot snapshot = coordinator.statusSnapshot();
                platform.sendMenu(event.getChatId(),
                        adminControls.userInfo(snapshot.getActiveUsers(), coordinator.topUsers(AdminControls.TOP_USER_LIMIT)),
                        adminControls.backButton());
            }
            case AdminControls.CALLBACK_SETTINGS ->
                    platform.sendMenu(event.getChatId(), adminControls.settings(), adminControls.backButton());
            case AdminControls.CALLBACK_SYSTEM ->
                    platform.sendMenu(event.getChatId(), adminControls.systemInfo(), adminControls.backButton());
            case AdminControls.CALLBACK_CLOSE -> platform.sendMessage(event.getChatId(), "🔧 Admin panel closed.");
            default -> log.warn("Unknown admin callback data: {}", data);
        }
    }

    public void handleUnknownCommand(InboundEvent event) {
        platform.sendMessage(event.getChatId(), BotMessages.UNKNOWN_COMMAND);
    }

    //실패 안내 메시지 전송 (전송 실패는 로그만 남김)
    private void replyQuietly(InboundEvent event, String text) {
        try {
            platform.sendMessage(event.getChatId(), text);
        } catch (ChatPlatformException e) {
            log.warn("Failed to deliver error reply to chat {}: {}", event.getChatId(), e.getMessage());
        }
    }

    private void logUserAction(InboundEvent event, String action, String details) {
        log.info("User {} (@{}) - {}{}", event.getUserId(),
                event.getUsername() != null ? event.getUsername() : "unknown",
                action, details.isEmpty() ? "" : " - " + details);
    }
}
