package com.openforge.memoria.agent;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Extraction provider configuration, bound from "memoria.agents":
 *
 * memoria:
 *   agents:
 *     sdk:
 *       executable: ""                # empty = look up "claude" on PATH
 *       model: ""                     # empty = CLI default
 *       timeout: 5m
 *     codex:
 *       executable: ""
 *       working-dir: ${user.home}/.memoria/observer-sessions
 *       timeout: 5m
 *     gemini:
 *       api-key: ...
 *       model: gemini-2.5-flash-lite
 *       base-url: https://generativelanguage.googleapis.com/v1beta
 *       rate-limiting-enabled: true
 *     openrouter:
 *       api-key: ...
 *       model: xiaomi/mimo-v2-flash:free
 *       base-url: https://openrouter.ai/api/v1
 *       app-name: memoria
 *     history:
 *       max-context-messages: 20
 *       max-estimated-tokens: 100000
 */
@ConfigurationProperties(prefix = "memoria.agents")
public record AgentProperties(
        @DefaultValue Cli sdk,
        @DefaultValue Cli codex,
        @DefaultValue Gemini gemini,
        @DefaultValue OpenRouter openrouter,
        @DefaultValue History history
) {

    public record Cli(
            @DefaultValue("") String executable,
            @DefaultValue("") String model,
            @DefaultValue("") String workingDir,
            @DefaultValue("5m") Duration timeout
    ) {}

    public record Gemini(
            @DefaultValue("") String apiKey,
            @DefaultValue("gemini-2.5-flash-lite") String model,
            @DefaultValue("https://generativelanguage.googleapis.com/v1beta") String baseUrl,
            @DefaultValue("true") boolean rateLimitingEnabled,
            @DefaultValue("120") int timeoutSeconds
    ) {}

    public record OpenRouter(
            @DefaultValue("") String apiKey,
            @DefaultValue("xiaomi/mimo-v2-flash:free") String model,
            @DefaultValue("https://openrouter.ai/api/v1") String baseUrl,
            @DefaultValue("") String siteUrl,
            @DefaultValue("memoria") String appName,
            @DefaultValue("120") int timeoutSeconds
    ) {}

    public record History(
            @DefaultValue("20") int maxContextMessages,
            @DefaultValue("100000") int maxEstimatedTokens
    ) {}
}
