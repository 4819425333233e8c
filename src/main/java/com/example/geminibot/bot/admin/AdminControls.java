package com.example.geminibot.bot.admin;

import com.example.geminibot.client.MenuButton;
import com.example.geminibot.config.BotProperties;
import com.example.geminibot.coordinator.StatusSnapshot;
import com.example.geminibot.util.MessageFormatUtil;
import com.example.geminibot.util.TimeUtil;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 관리자 패널 문구와 버튼 구성
 */
@Component
@RequiredArgsConstructor
public class AdminControls {

    public static final String CALLBACK_STATS = "admin_stats";
    public static final String CALLBACK_USERS = "admin_users";
    public static final String CALLBACK_SETTINGS = "admin_settings";
    public static final String CALLBACK_SYSTEM = "admin_system";
    public static final String CALLBACK_BACK = "admin_back";
    public static final String CALLBACK_CLOSE = "admin_close";

    public static final int TOP_USER_LIMIT = 10;

    private final BotProperties properties;

    public String panelText() {
        return "🔧 Admin Control Panel\n\nSelect an option to manage the bot:";
    }

    public List<List<MenuButton>> panelButtons() {
        return List.of(
                List.of(MenuButton.of("📊 Detailed Stats", CALLBACK_STATS),
                        MenuButton.of("👥 User Info", CALLBACK_USERS)),
                List.of(MenuButton.of("⚙️ Bot Settings", CALLBACK_SETTINGS),
                        MenuButton.of("📋 System Info", CALLBACK_SYSTEM)),
                List.of(MenuButton.of("❌ Close", CALLBACK_CLOSE)));
    }

    public List<List<MenuButton>> backButton() {
        return List.of(List.of(MenuButton.of("🔙 Back to Admin Panel", CALLBACK_BACK)));
    }

    public String detailedStats(StatusSnapshot snapshot) {
        return "📊 Detailed Bot Statistics\n\n"
                + "⏰ Uptime: " + snapshot.getUptimeFormatted() + "\n"
                + "🚀 Started: " + TimeUtil.formatTimestamp(snapshot.getStartTime()) + "\n\n"
                + "📈 Usage Statistics:\n"
                + "• Messages Processed: " + snapshot.getMessagesProcessed() + "\n"
                + "• Images Analyzed: " + snapshot.getImagesAnalyzed() + "\n"
                + "• Images Generated: " + snapshot.getImagesGenerated() + "\n"
                + "• Total Errors: " + snapshot.getErrors() + "\n\n"
                + "👥 User Statistics:\n"
                + "• Active Users: " + snapshot.getActiveUsers() + "\n"
                + "• Total Conversations: " + snapshot.getContextSizeTotal() + "\n\n"
                + "💾 Performance:\n"
                + "• Error Rate: " + String.format(Locale.ROOT, "%.2f", snapshot.getErrorRate()) + "%\n"
                + "• Avg Messages/User: " + String.format(Locale.ROOT, "%.1f", snapshot.getAverageMessagesPerUser());
    }

    public String userInfo(int activeUsers, Map<Long, Integer> topUsers) {
        if (topUsers.isEmpty()) {
            return "👥 User Information\n\nNo active users found.";
        }

        StringBuilder text = new StringBuilder("👥 User Information\n\nActive Users: ")
                .append(activeUsers)
                .append("\n\n");
        int rank = 1;
        for (Map.Entry<Long, Integer> entry : topUsers.entrySet()) {
            text.append(rank++).append(". User ID: ").append(entry.getKey())
                    .append(" - ").append(entry.getValue()).append(" messages\n");
        }
        return text.toString();
    }

    public String settings() {
        BotProperties.RateLimit rateLimit = properties.getRateLimit();
        return "⚙️ Bot Settings\n\n"
                + "🔧 Current Configuration:\n"
                + "• Max Message Length: " + properties.getMaxMessageLength() + " chars\n"
                + "• Max Image Size: " + MessageFormatUtil.bytesToMegabytes(properties.getMaxImageSize()) + "MB\n"
                + "• Rate Limit: " + rateLimit.getLimit() + " msgs/" + rateLimit.getWindowSeconds() + "s\n"
                + "• Context Size: " + properties.getContext().getMaxTurns() + " turns\n"
                + "• Supported Formats: " + String.join(", ", properties.getAllowedImageTypes()) + "\n\n"
                + "📝 Note: Settings are configured via environment variables.";
    }

    public String systemInfo() {
        Runtime runtime = Runtime.getRuntime();
        long usedMb = (runtime.totalMemory() - runtime.freeMemory()) / 1024 / 1024;
        long maxMb = runtime.maxMemory() / 1024 / 1024;

        return "📋 System Information\n\n"
                + "🖥️ System:\n"
                + "• OS: " + System.getProperty("os.name") + " " + System.getProperty("os.version") + "\n"
                + "• Java: " + System.getProperty("java.version") + "\n\n"
                + "⚡ Performance:\n"
                + "• Processors: " + runtime.availableProcessors() + "\n"
                + "• Heap: " + usedMb + "MB / " + maxMb + "MB\n"
                + "• Threads: " + Thread.activeCount();
    }
}
