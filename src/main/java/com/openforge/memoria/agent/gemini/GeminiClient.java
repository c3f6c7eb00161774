package com.openforge.memoria.agent.gemini;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.memoria.agent.AgentCancelledException;
import com.openforge.memoria.agent.AgentProperties;
import com.openforge.memoria.agent.FatalAgentException;
import com.openforge.memoria.agent.TransientAgentException;
import com.openforge.memoria.session.ConversationMessage;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

/**
 * Stateless client for the Gemini {@code generateContent} REST endpoint.
 *
 * HTTP status mapping:
 *   429, 5xx       → {@link TransientAgentException} (retried, counted by the breaker)
 *   400, 401, 403, 404 → {@link FatalAgentException} (bad key or model name)
 */
@Slf4j
public class GeminiClient {

    private final HttpClient             httpClient;
    private final ObjectMapper           objectMapper;
    private final AgentProperties.Gemini config;

    public GeminiClient(HttpClient httpClient, ObjectMapper objectMapper, AgentProperties.Gemini config) {
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.config       = config;
    }

    public String generate(List<ConversationMessage> history) {
        String body = serialize(history);
        log.debug("[Gemini] → generateContent model={} turns={} body-length={}",
                config.model(), history.size(), body.length());

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create("%s/models/%s:generateContent?key=%s".formatted(
                        config.baseUrl(), config.model(),
                        URLEncoder.encode(config.apiKey(), StandardCharsets.UTF_8))))
                .header("Content-Type", "application/json")
                .timeout(Duration.ofSeconds(config.timeoutSeconds()))
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new TransientAgentException("Network error calling Gemini: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AgentCancelledException("Interrupted while calling Gemini");
        }
        return parse(response);
    }

    private String serialize(List<ConversationMessage> history) {
        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode contents = root.putArray("contents");
        for (ConversationMessage message : history) {
            ObjectNode content = contents.addObject();
            content.put("role", message.role() == ConversationMessage.Role.ASSISTANT ? "model" : "user");
            content.putArray("parts").addObject().put("text", message.content());
        }
        ObjectNode generationConfig = root.putObject("generationConfig");
        generationConfig.put("temperature", 0.3);
        generationConfig.put("maxOutputTokens", 4096);
        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize Gemini request", e);
        }
    }

    private String parse(HttpResponse<String> response) {
        int status = response.statusCode();
        String body = response.body();
        log.debug("[Gemini] ← HTTP {} body-length={}", status, body == null ? 0 : body.length());

        if (status == 429 || status >= 500) {
            throw new TransientAgentException("Gemini returned HTTP %d: %s".formatted(status, body));
        }
        if (status < 200 || status >= 300) {
            throw new FatalAgentException("Gemini rejected the request (HTTP %d): %s".formatted(status, body));
        }

        try {
            JsonNode parts = objectMapper.readTree(body).path("candidates").path(0).path("content").path("parts");
            StringBuilder text = new StringBuilder();
            for (JsonNode part : parts) {
                text.append(part.path("text").asText(""));
            }
            return text.toString().trim();
        } catch (JsonProcessingException e) {
            throw new TransientAgentException("Failed to parse Gemini response: " + body, e);
        }
    }
}
