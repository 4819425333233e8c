package com.example.geminibot.client;

public enum ParseMode {
    PLAIN,
    MARKDOWN_V2
}
