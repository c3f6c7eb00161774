package com.openforge.memoria.worker;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;

/**
 * Processing-side policy, bound from "memoria.worker":
 *
 * memoria:
 *   worker:
 *     provider: claude          # claude | gemini | openrouter | codex | auto
 *     max-retries: 3            # per-message failure budget
 *     poll-interval: 1s         # max latency for a cancellation to be observed
 *     idle-timeout: 3m          # empty-queue wait before a consumer exits
 *     shutdown-timeout: 30s     # graceful drain budget on stop
 *     skip-tools: [TodoWrite, …]
 */
@ConfigurationProperties(prefix = "memoria.worker")
public record WorkerProperties(
        @DefaultValue("claude") String provider,
        @DefaultValue("3") int maxRetries,
        @DefaultValue("1s") Duration pollInterval,
        @DefaultValue("3m") Duration idleTimeout,
        @DefaultValue("30s") Duration shutdownTimeout,
        @DefaultValue({"ListMcpResourcesTool", "SlashCommand", "Skill", "TodoWrite", "AskUserQuestion"})
        List<String> skipTools
) {
}
