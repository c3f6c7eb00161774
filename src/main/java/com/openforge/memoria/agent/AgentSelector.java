package com.openforge.memoria.agent;

import com.openforge.memoria.worker.WorkerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Picks the extraction agent for a new consumer run, and the fallback chain
 * to walk when that agent loses its provider conversation.
 *
 *   provider=openrouter → OpenRouter if available, else claude
 *   provider=gemini     → Gemini if available, else claude
 *   provider=codex      → Codex if available, else claude
 *   provider=auto       → OpenRouter, then Gemini, then claude
 *   anything else       → claude
 *
 * Fallback chain: gemini, then openrouter, skipping the agent that failed.
 */
@Slf4j
@Component
public class AgentSelector {

    public static final String CLAUDE     = "claude";
    public static final String GEMINI     = "gemini";
    public static final String OPENROUTER = "openrouter";
    public static final String CODEX      = "codex";
    public static final String AUTO       = "auto";

    private static final List<String> FALLBACK_ORDER = List.of(GEMINI, OPENROUTER);

    private final Map<String, ExtractionAgent> agents = new LinkedHashMap<>();
    private final String provider;

    public AgentSelector(List<ExtractionAgent> agents, WorkerProperties workerProperties) {
        for (ExtractionAgent agent : agents) {
            this.agents.put(agent.name(), agent);
        }
        if (!this.agents.containsKey(CLAUDE)) {
            throw new IllegalStateException("The claude extraction agent must be registered");
        }
        this.provider = workerProperties.provider() == null
                ? CLAUDE
                : workerProperties.provider().trim().toLowerCase(Locale.ROOT);
    }

    public ExtractionAgent select() {
        ExtractionAgent chosen = switch (provider) {
            case OPENROUTER -> availableOrDefault(OPENROUTER);
            case GEMINI     -> availableOrDefault(GEMINI);
            case CODEX      -> availableOrDefault(CODEX);
            case AUTO       -> available(OPENROUTER)
                    .or(() -> available(GEMINI))
                    .orElseGet(this::primary);
            default         -> primary();
        };
        if (!chosen.name().equals(provider) && !AUTO.equals(provider)) {
            log.warn("[Selector] Provider '{}' unavailable, using {}", provider, chosen.name());
        }
        return chosen;
    }

    /** Agents to try, in order, after {@code failed} reported a terminated session. */
    public List<ExtractionAgent> fallbackChain(ExtractionAgent failed) {
        List<ExtractionAgent> chain = new ArrayList<>();
        for (String name : FALLBACK_ORDER) {
            ExtractionAgent candidate = agents.get(name);
            if (candidate != null && candidate != failed) {
                chain.add(candidate);
            }
        }
        return chain;
    }

    public List<ExtractionAgent> all() {
        return List.copyOf(agents.values());
    }

    public String configuredProvider() {
        return provider;
    }

    private ExtractionAgent primary() {
        return agents.get(CLAUDE);
    }

    private ExtractionAgent availableOrDefault(String name) {
        return available(name).orElseGet(this::primary);
    }

    private Optional<ExtractionAgent> available(String name) {
        return Optional.ofNullable(agents.get(name)).filter(ExtractionAgent::isAvailable);
    }
}
