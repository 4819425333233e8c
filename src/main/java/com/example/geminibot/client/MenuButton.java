package com.example.geminibot.client;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 메시지에 붙는 선택 버튼 (표시 문구 + 콜백 데이터)
 */
@Getter
@ToString
@AllArgsConstructor(staticName = "of")
public class MenuButton {
    private final String label;
    private final String callbackData;
}
