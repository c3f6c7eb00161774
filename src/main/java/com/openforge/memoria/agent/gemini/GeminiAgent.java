package com.openforge.memoria.agent.gemini;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.memoria.agent.AbstractExtractionAgent;
import com.openforge.memoria.agent.AgentProperties;
import com.openforge.memoria.agent.AgentReply;
import com.openforge.memoria.agent.AgentRuntime;
import com.openforge.memoria.agent.AgentSelector;
import com.openforge.memoria.agent.FatalAgentException;
import com.openforge.memoria.agent.TransientAgentException;
import com.openforge.memoria.session.CancellationToken;
import com.openforge.memoria.session.SessionContext;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.util.function.Supplier;

/**
 * Secondary agent A: Gemini over REST, replaying truncated history on every
 * call.
 *
 * Calls go through the "gemini" retry and circuit breaker, and through the
 * "gemini" rate limiter when free-tier limiting is enabled. An open breaker
 * makes the agent report itself unavailable to the selector.
 */
@Slf4j
@Component
public class GeminiAgent extends AbstractExtractionAgent {

    public static final String RESILIENCE_NAME = "gemini";

    private final AgentProperties.Gemini config;
    private final GeminiClient           client;
    private final CircuitBreaker         circuitBreaker;
    private final Retry                  retry;
    private final RateLimiter            rateLimiter;

    public GeminiAgent(AgentRuntime runtime,
                       AgentProperties properties,
                       HttpClient httpClient,
                       ObjectMapper objectMapper,
                       CircuitBreakerRegistry circuitBreakers,
                       RetryRegistry retries,
                       RateLimiterRegistry rateLimiters) {
        super(runtime);
        this.config         = properties.gemini();
        this.client         = new GeminiClient(httpClient, objectMapper, config);
        this.circuitBreaker = circuitBreakers.circuitBreaker(RESILIENCE_NAME);
        this.retry          = retries.retry(RESILIENCE_NAME);
        this.rateLimiter    = rateLimiters.rateLimiter(RESILIENCE_NAME);
    }

    @Override
    public String name() {
        return AgentSelector.GEMINI;
    }

    @Override
    public boolean isAvailable() {
        return !config.apiKey().isBlank() && circuitBreaker.getState() != CircuitBreaker.State.OPEN;
    }

    @Override
    protected void ensureReady() {
        if (config.apiKey().isBlank()) {
            throw new FatalAgentException("Gemini API key not configured (memoria.agents.gemini.api-key)");
        }
    }

    @Override
    protected AgentReply query(SessionContext context, CancellationToken token, String prompt) {
        Supplier<String> call = () -> {
            token.throwIfCancelled();
            return client.generate(runtime.history().truncate(context.getConversationHistory()));
        };
        Supplier<String> decorated = CircuitBreaker.decorateSupplier(circuitBreaker, call);
        decorated = Retry.decorateSupplier(retry, decorated);
        if (config.rateLimitingEnabled()) {
            decorated = RateLimiter.decorateSupplier(rateLimiter, decorated);
        }

        try {
            return AgentReply.of(decorated.get());
        } catch (CallNotPermittedException e) {
            throw new TransientAgentException("Gemini circuit breaker is open", e);
        } catch (RequestNotPermitted e) {
            throw new TransientAgentException("Gemini rate limit wait exceeded", e);
        }
    }
}
