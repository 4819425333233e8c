package com.example.geminibot.context;

/**
 * 대화 턴의 발화 주체
 */
public enum TurnRole {
    USER("user"),
    ASSISTANT("assistant");

    private final String value;

    TurnRole(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }
}
