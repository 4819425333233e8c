package com.example.geminibot.client.gemini;

import com.example.geminibot.client.GeneratedImage;
import com.example.geminibot.client.GenerativeAiClient;
import com.example.geminibot.client.GenerativeAiException;
import com.example.geminibot.config.BotProperties;
import com.example.geminibot.context.ConversationTurn;
import com.example.geminibot.context.TurnRole;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.Base64;
import java.util.List;

/**
 * Gemini generateContent REST API 클라이언트
 */
@Slf4j
public class GeminiClient implements GenerativeAiClient {

    static final String DEFAULT_ANALYSIS_PROMPT = "Analyze this image in detail. Describe what you see, including objects, "
            + "people, activities, colors, composition, and any notable aspects. "
            + "Provide a comprehensive analysis.";
    private static final String NO_RESPONSE = "Sorry, I couldn't generate a response.";
    private static final String NO_ANALYSIS = "Sorry, I couldn't analyze this image.";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final BotProperties.Gemini config;

    public GeminiClient(RestClient.Builder restClientBuilder, ObjectMapper objectMapper, BotProperties.Gemini config) {
        this.restClient = restClientBuilder
                .baseUrl(config.getBaseUrl())
                .defaultHeader("x-goog-api-key", config.getApiKey())
                .build();
        this.objectMapper = objectMapper;
        this.config = config;
    }

    @Override
    public String generateResponse(String prompt) {
        ObjectNode request = objectMapper.createObjectNode();
        addContent(request.putArray("contents"), "user").addObject().put("text", prompt);

        String text = extractText(generate(config.getTextModel(), request));
        return text.isEmpty() ? NO_RESPONSE : text;
    }

    @Override
    public String chatWithContext(List<ConversationTurn> turns) {
        ObjectNode request = objectMapper.createObjectNode();
        ArrayNode contents = request.putArray("contents");

        // 최근 contextTurns 개만 전송
        int from = Math.max(0, turns.size() - config.getContextTurns());
        for (ConversationTurn turn : turns.subList(from, turns.size())) {
            String role = turn.getRole() == TurnRole.USER ? "user" : "model";
            addContent(contents, role).addObject().put("text", turn.getText());
        }

        String text = extractText(generate(config.getTextModel(), request));
        return text.isEmpty() ? NO_RESPONSE : text;
    }

    @Override
    public String analyzeImage(byte[] image, String prompt) {
        String analysisPrompt = prompt == null || prompt.isBlank() ? DEFAULT_ANALYSIS_PROMPT : prompt;

        ObjectNode request = objectMapper.createObjectNode();
        ArrayNode parts = addContent(request.putArray("contents"), "user");
        ObjectNode inlineData = parts.addObject().putObject("inline_data");
        inlineData.put("mime_type", "image/jpeg");
        inlineData.put("data", Base64.getEncoder().encodeToString(image));
        parts.addObject().put("text", analysisPrompt);

        String text = extractText(generate(config.getVisionModel(), request));
        return text.isEmpty() ? NO_ANALYSIS : text;
    }

    @Override
    public GeneratedImage generateImage(String prompt) {
        ObjectNode request = objectMapper.createObjectNode();
        addContent(request.putArray("contents"), "user").addObject().put("text", "Generate an image: " + prompt);
        request.putObject("generationConfig").putArray("responseModalities").add("TEXT").add("IMAGE");

        JsonNode response = generate(config.getImageModel(), request);
        JsonNode parts = firstCandidateParts(response);

        byte[] imageData = null;
        StringBuilder description = new StringBuilder();
        for (JsonNode part : parts) {
            if (part.hasNonNull("text")) {
                description.append(part.get("text").asText());
            } else if (part.path("inlineData").hasNonNull("data")) {
                imageData = Base64.getDecoder().decode(part.path("inlineData").get("data").asText());
            }
        }

        if (imageData == null) {
            throw new GenerativeAiException("No image data received");
        }
        return new GeneratedImage(imageData, description.length() > 0 ? description.toString() : "Image generated successfully");
    }

    //contents 배열에 role 이 지정된 항목을 추가하고 parts 배열 반환
    private ArrayNode addContent(ArrayNode contents, String role) {
        ObjectNode content = contents.addObject();
        content.put("role", role);
        return content.putArray("parts");
    }

    private JsonNode generate(String model, ObjectNode request) {
        try {
            JsonNode response = restClient.post()
                    .uri("/models/{model}:generateContent", model)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(request)
                    .retrieve()
                    .body(JsonNode.class);
            if (response == null) {
                throw new GenerativeAiException("Empty response from model " + model);
            }
            return response;
        } catch (RestClientException e) {
            log.error("Gemini request to model {} failed: {}", model, e.getMessage());
            throw new GenerativeAiException("Gemini request failed: " + e.getMessage(), e);
        }
    }

    private JsonNode firstCandidateParts(JsonNode response) {
        JsonNode candidates = response.path("candidates");
        if (!candidates.isArray() || candidates.isEmpty()) {
            throw new GenerativeAiException("No candidates returned");
        }
        JsonNode parts = candidates.get(0).path("content").path("parts");
        if (!parts.isArray() || parts.isEmpty()) {
            throw new GenerativeAiException("No content received");
        }
        return parts;
    }

    private String extractText(JsonNode response) {
        StringBuilder text = new StringBuilder();
        for (JsonNode part : firstCandidateParts(response)) {
            if (part.hasNonNull("text")) {
                text.append(part.get("text").asText());
            }
        }
        return text.toString();
    }
}
