package com.openforge.memoria.agent;

import com.openforge.memoria.session.CancellationToken;
import com.openforge.memoria.session.SessionContext;
import com.openforge.memoria.worker.WorkerProperties;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AgentSelectorTest {

    private final StubAgent claude     = new StubAgent("claude", true);
    private final StubAgent gemini     = new StubAgent("gemini", true);
    private final StubAgent openRouter = new StubAgent("openrouter", true);
    private final StubAgent codex      = new StubAgent("codex", true);

    @Test
    void explicitProviderIsUsedWhenAvailable() {
        assertThat(selector("gemini").select()).isSameAs(gemini);
        assertThat(selector("OpenRouter").select()).isSameAs(openRouter);
        assertThat(selector("codex").select()).isSameAs(codex);
        assertThat(selector("claude").select()).isSameAs(claude);
    }

    @Test
    void unavailableProviderFallsBackToClaude() {
        gemini.available = false;

        assertThat(selector("gemini").select()).isSameAs(claude);
    }

    @Test
    void unknownProviderUsesClaude() {
        assertThat(selector("mystery").select()).isSameAs(claude);
    }

    @Test
    void autoPrefersOpenRouterThenGemini() {
        assertThat(selector("auto").select()).isSameAs(openRouter);

        openRouter.available = false;
        assertThat(selector("auto").select()).isSameAs(gemini);

        gemini.available = false;
        assertThat(selector("auto").select()).isSameAs(claude);
    }

    @Test
    void fallbackChainIsGeminiThenOpenRouterWithoutTheFailedAgent() {
        AgentSelector selector = selector("claude");

        assertThat(selector.fallbackChain(claude)).containsExactly(gemini, openRouter);
        assertThat(selector.fallbackChain(gemini)).containsExactly(openRouter);
        assertThat(selector.fallbackChain(openRouter)).containsExactly(gemini);
    }

    @Test
    void claudeAgentIsRequired() {
        assertThatThrownBy(() -> new AgentSelector(List.of(gemini), properties("gemini")))
                .isInstanceOf(IllegalStateException.class);
    }

    private AgentSelector selector(String provider) {
        return new AgentSelector(List.of(claude, gemini, openRouter, codex), properties(provider));
    }

    private static WorkerProperties properties(String provider) {
        return new WorkerProperties(provider, 3, Duration.ofMillis(20), Duration.ofMillis(200),
                Duration.ofSeconds(2), List.of());
    }

    private static final class StubAgent implements ExtractionAgent {
        private final String name;
        private boolean available;

        StubAgent(String name, boolean available) {
            this.name = name;
            this.available = available;
        }

        @Override public String name() { return name; }
        @Override public boolean isAvailable() { return available; }
        @Override public void startSession(SessionContext context, CancellationToken token) { }
    }
}
