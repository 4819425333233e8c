package com.example.geminibot.client.telegram;

import com.example.geminibot.config.BotProperties;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
@DisplayName("Telegram 클라이언트 요청 경로 테스트")
class TelegramChatPlatformClientTest {

    private static final byte[] FILE_CONTENT = {1, 2, 3, 4};

    private final List<String> requestPaths = new CopyOnWriteArrayList<>();
    private HttpServer server;
    private TelegramChatPlatformClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        server.createContext("/", this::handle);
        server.start();

        BotProperties.Telegram config = new BotProperties.Telegram();
        config.setToken("123:ABC");
        config.setApiBaseUrl("http://localhost:" + server.getAddress().getPort());
        client = new TelegramChatPlatformClient(RestClient.builder(), config);
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    @DisplayName("토큰의 콜론과 파일 경로의 슬래시는 인코딩하지 않음")
    void testDownloadFileUsesRawPaths() {
        byte[] content = client.downloadFile("file-id-1");

        log.info("요청 경로: {}", requestPaths);
        assertEquals(List.of("/bot123:ABC/getFile", "/file/bot123:ABC/photos/file_1.jpg"), requestPaths,
                "Bot API 경로가 그대로 전달되어야 합니다");
        assertArrayEquals(FILE_CONTENT, content, "다운로드한 파일 내용이 일치해야 합니다");
    }

    @Test
    @DisplayName("메서드 호출 경로")
    void testMethodCallPath() {
        client.answerCallback("cb-1");

        assertEquals(List.of("/bot123:ABC/answerCallbackQuery"), requestPaths);
    }

    private void handle(HttpExchange exchange) throws IOException {
        String path = exchange.getRequestURI().getRawPath();
        requestPaths.add(path);
        exchange.getRequestBody().readAllBytes();

        byte[] body;
        if (path.startsWith("/file/")) {
            exchange.getResponseHeaders().add("Content-Type", "application/octet-stream");
            body = FILE_CONTENT;
        } else if (path.endsWith("/getFile")) {
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            body = "{\"ok\":true,\"result\":{\"file_path\":\"photos/file_1.jpg\"}}".getBytes(StandardCharsets.UTF_8);
        } else {
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            body = "{\"ok\":true,\"result\":true}".getBytes(StandardCharsets.UTF_8);
        }

        exchange.sendResponseHeaders(200, body.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(body);
        }
    }
}
