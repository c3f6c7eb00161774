package com.openforge.memoria.config;

import com.openforge.memoria.agent.AgentCancelledException;
import com.openforge.memoria.agent.FatalAgentException;
import com.openforge.memoria.agent.TransientAgentException;
import com.openforge.memoria.agent.gemini.GeminiAgent;
import com.openforge.memoria.agent.openrouter.OpenRouterAgent;
import com.openforge.memoria.llm.LlmClient;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Programmatic Resilience4j wiring.
 *
 * One named instance per HTTP provider:
 *   • "gemini"     — circuit breaker, retry, free-tier rate limiter
 *   • "openrouter" — circuit breaker, retry
 *
 * An OPEN breaker makes the agent report itself unavailable, so the
 * selector and the fallback chain skip it.
 */
@Configuration
public class Resilience4jConfig {

    // ── Circuit Breaker ──────────────────────────────────────────────────────

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                // trip after 50 % of the last 10 calls fail
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(10)
                .failureRateThreshold(50)
                // treat slow calls (>60 s) as failures
                .slowCallDurationThreshold(Duration.ofSeconds(60))
                .slowCallRateThreshold(80)
                // allow 2 probe calls while HALF-OPEN
                .permittedNumberOfCallsInHalfOpenState(2)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                // a cancelled call says nothing about provider health
                .ignoreExceptions(AgentCancelledException.class)
                .build();

        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(config);
        // Force-create the named breakers so they appear in Actuator metrics
        registry.circuitBreaker(GeminiAgent.RESILIENCE_NAME);
        registry.circuitBreaker(OpenRouterAgent.RESILIENCE_NAME);
        return registry;
    }

    // ── Retry ────────────────────────────────────────────────────────────────

    @Bean
    public RetryRegistry retryRegistry() {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(3)
                .waitDuration(Duration.ofSeconds(1))
                // only failures that can go away by themselves
                .retryOnException(Resilience4jConfig::isRetryable)
                .build();

        RetryRegistry registry = RetryRegistry.of(config);
        registry.retry(GeminiAgent.RESILIENCE_NAME);
        registry.retry(OpenRouterAgent.RESILIENCE_NAME);
        return registry;
    }

    // ── Rate Limiter ─────────────────────────────────────────────────────────

    /**
     * Gemini free tier: 10 requests per minute for the flash models. Callers
     * wait up to two minutes for a permit before the call is reported as
     * transient.
     */
    @Bean
    public RateLimiterRegistry rateLimiterRegistry() {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitForPeriod(10)
                .limitRefreshPeriod(Duration.ofMinutes(1))
                .timeoutDuration(Duration.ofMinutes(2))
                .build();

        RateLimiterRegistry registry = RateLimiterRegistry.of(config);
        registry.rateLimiter(GeminiAgent.RESILIENCE_NAME);
        return registry;
    }

    static boolean isRetryable(Throwable error) {
        if (error instanceof AgentCancelledException || error instanceof FatalAgentException) {
            return false;
        }
        if (error instanceof LlmClient.LlmException llmError) {
            return !llmError.isClientError() && !Thread.currentThread().isInterrupted();
        }
        return error instanceof TransientAgentException;
    }
}
