package com.openforge.memoria.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.memoria.agent.AgentProperties;
import com.openforge.memoria.llm.model.ChatRequest;
import com.openforge.memoria.llm.model.ChatResponse;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Stateless client for OpenAI-compatible chat completions (OpenRouter).
 *
 * Blocking by design: it runs on the session's consumer thread, which has
 * nothing else to do while the provider answers.
 *
 * OpenRouter attribution headers (HTTP-Referer, X-Title) are sent when
 * configured.
 */
@Slf4j
public class LlmClient {

    private final HttpClient   httpClient;
    private final ObjectMapper objectMapper;
    private final AgentProperties.OpenRouter config;

    public LlmClient(HttpClient httpClient,
                     ObjectMapper objectMapper,
                     AgentProperties.OpenRouter config) {
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.config       = config;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    public ChatResponse chat(ChatRequest request) {
        String requestBody = serialize(request);
        log.debug("[LlmClient:openrouter] → chat POST model={} body-length={}", request.model(), requestBody.length());
        return parseFullResponse(sendBlocking(buildHttpRequest(requestBody)));
    }

    public String modelName() {
        return config.model();
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private HttpRequest buildHttpRequest(String body) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(config.baseUrl() + "/chat/completions"))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + config.apiKey())
                .timeout(Duration.ofSeconds(config.timeoutSeconds()))
                .POST(HttpRequest.BodyPublishers.ofString(body));
        if (!config.siteUrl().isBlank()) {
            builder.header("HTTP-Referer", config.siteUrl());
        }
        if (!config.appName().isBlank()) {
            builder.header("X-Title", config.appName());
        }
        return builder.build();
    }

    private HttpResponse<String> sendBlocking(HttpRequest request) {
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new LlmException(0, "Network error calling OpenRouter: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmException(0, "Interrupted while calling OpenRouter", e);
        }
    }

    private ChatResponse parseFullResponse(HttpResponse<String> response) {
        int    status = response.statusCode();
        String body   = response.body();
        log.debug("[LlmClient:openrouter] ← HTTP {} body-length={}", status, body == null ? 0 : body.length());

        if (status == 429) throw new LlmRateLimitException("Rate-limited by OpenRouter.");
        if (status < 200 || status >= 300) throw new LlmException(status,
                "OpenRouter returned HTTP %d: %s".formatted(status, body), null);

        try {
            return objectMapper.readValue(body, ChatResponse.class);
        } catch (JsonProcessingException e) {
            throw new LlmException(status, "Failed to parse OpenRouter response: " + body, e);
        }
    }

    private String serialize(Object obj) {
        try {
            return objectMapper.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize request", e);
        }
    }

    // ── Exception types ──────────────────────────────────────────────────────

    public static class LlmException extends RuntimeException {

        private final int statusCode;

        public LlmException(int statusCode, String message, Throwable cause) {
            super(message, cause);
            this.statusCode = statusCode;
        }

        /** HTTP status, 0 when the request never got an answer. */
        public int statusCode() {
            return statusCode;
        }

        /** Client errors other than 408/429 will not go away by retrying. */
        public boolean isClientError() {
            return statusCode >= 400 && statusCode < 500 && statusCode != 408 && statusCode != 429;
        }
    }

    public static class LlmRateLimitException extends LlmException {
        public LlmRateLimitException(String message) {
            super(429, message, null);
        }
    }
}
