package com.example.geminibot.controller;

import com.example.geminibot.bot.EventType;
import com.example.geminibot.bot.InboundEvent;
import com.example.geminibot.bot.InboundProcessingLoop;
import com.example.geminibot.client.telegram.TelegramUpdateMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(WebhookController.class)
@Import(TelegramUpdateMapper.class)
@DisplayName("Webhook 수신 테스트")
class WebhookControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private InboundProcessingLoop processingLoop;

    @Test
    @DisplayName("텍스트 업데이트는 처리 루프에 제출")
    void testTextUpdateQueued() throws Exception {
        when(processingLoop.submit(any(InboundEvent.class))).thenReturn(true);

        mockMvc.perform(post("/webhook")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"update_id\":1,\"message\":{\"chat\":{\"id\":5},\"from\":{\"id\":7},\"text\":\"hi\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("received"));

        verify(processingLoop).submit(argThat(event -> event.getType() == EventType.TEXT && "hi".equals(event.getText())));
    }

    @Test
    @DisplayName("처리하지 않는 업데이트는 무시")
    void testUnsupportedUpdateIgnored() throws Exception {
        mockMvc.perform(post("/webhook")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"update_id\":2,\"edited_message\":{\"text\":\"x\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ignored"));

        verify(processingLoop, never()).submit(any(InboundEvent.class));
    }

    @Test
    @DisplayName("잘못된 JSON 은 400")
    void testMalformedBody() throws Exception {
        mockMvc.perform(post("/webhook")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest());
    }
}
