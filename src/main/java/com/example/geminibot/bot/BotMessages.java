package com.example.geminibot.bot;

/**
 * 사용자에게 보내는 고정 문구
 */
public final class BotMessages {

    public static final String RATE_LIMITED = "⚠️ You're sending requests too quickly. Please wait a moment.";
    public static final String ACCESS_DENIED = "❌ Access denied. Admin only.";
    public static final String GENERIC_FAILURE = "❌ Sorry, I encountered an error. Please try again later.";
    public static final String CONTEXT_CLEARED = "🗑️ Conversation context cleared! Starting fresh.";
    public static final String GENERATING = "🎨 Generating your image, please wait...";
    public static final String ANALYZING = "🔍 Analyzing your image, please wait...";
    public static final String IMAGE_TOO_LARGE = "❌ Image is too large. Maximum size is %dMB.";
    public static final String GENERATE_USAGE = "Please provide a prompt for image generation.\n"
            + "Example: /generate a beautiful sunset over mountains";
    public static final String UNKNOWN_COMMAND = "🤔 Unknown command. Use /help to see what I can do.";

    public static final String WELCOME = "🤖 Welcome to Advanced Gemini AI Bot, %s!\n\n"
            + "🌟 Features:\n"
            + "• 💬 Chat with Gemini AI\n"
            + "• 🖼️ Generate images with /generate\n"
            + "• 🔍 Analyze images (just send a photo)\n"
            + "• 📊 Get bot status with /status\n\n"
            + "Simply send me a message to start chatting!";
    public static final String WELCOME_ADMIN = "\n\n🔧 Admin Commands:\n"
            + "• /admin - Admin panel\n"
            + "• /stats - Detailed statistics";

    public static final String HELP = "🤖 Bot Commands:\n\n"
            + "🔹 /start - Welcome message\n"
            + "🔹 /help - This help message\n"
            + "🔹 /generate <prompt> - Generate an image\n"
            + "🔹 /status - Bot status information\n"
            + "🔹 /clear - Clear conversation context\n\n"
            + "💬 Chat Features:\n"
            + "• Send any text message to chat with Gemini AI\n"
            + "• Send photos for detailed image analysis\n"
            + "• Context is maintained for better conversations\n\n"
            + "📸 Image Analysis:\n"
            + "• Send any image and I'll analyze it in detail\n"
            + "• Supports JPEG, PNG, and WebP formats\n"
            + "• Max file size: 20MB\n\n"
            + "🎨 Image Generation:\n"
            + "• Use /generate followed by your prompt\n"
            + "• Example: /generate a sunset over mountains";

    private BotMessages() {
    }
}
