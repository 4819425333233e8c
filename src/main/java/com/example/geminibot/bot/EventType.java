package com.example.geminibot.bot;

public enum EventType {
    COMMAND,
    TEXT,
    PHOTO,
    CALLBACK
}
