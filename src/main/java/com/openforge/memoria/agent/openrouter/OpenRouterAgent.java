package com.openforge.memoria.agent.openrouter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.memoria.agent.AbstractExtractionAgent;
import com.openforge.memoria.agent.AgentCancelledException;
import com.openforge.memoria.agent.AgentProperties;
import com.openforge.memoria.agent.AgentReply;
import com.openforge.memoria.agent.AgentRuntime;
import com.openforge.memoria.agent.AgentSelector;
import com.openforge.memoria.agent.FatalAgentException;
import com.openforge.memoria.agent.TransientAgentException;
import com.openforge.memoria.llm.LlmClient;
import com.openforge.memoria.llm.model.ChatRequest;
import com.openforge.memoria.llm.model.Message;
import com.openforge.memoria.session.CancellationToken;
import com.openforge.memoria.session.ConversationMessage;
import com.openforge.memoria.session.SessionContext;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.util.List;
import java.util.function.Supplier;

/**
 * Secondary agent B: OpenRouter chat completions, replaying truncated
 * history on every call, wrapped in the "openrouter" retry and circuit
 * breaker.
 */
@Slf4j
@Component
public class OpenRouterAgent extends AbstractExtractionAgent {

    public static final String RESILIENCE_NAME = "openrouter";

    private final AgentProperties.OpenRouter config;
    private final LlmClient                  client;
    private final CircuitBreaker             circuitBreaker;
    private final Retry                      retry;

    public OpenRouterAgent(AgentRuntime runtime,
                           AgentProperties properties,
                           HttpClient httpClient,
                           ObjectMapper objectMapper,
                           CircuitBreakerRegistry circuitBreakers,
                           RetryRegistry retries) {
        super(runtime);
        this.config         = properties.openrouter();
        this.client         = new LlmClient(httpClient, objectMapper, config);
        this.circuitBreaker = circuitBreakers.circuitBreaker(RESILIENCE_NAME);
        this.retry          = retries.retry(RESILIENCE_NAME);
    }

    @Override
    public String name() {
        return AgentSelector.OPENROUTER;
    }

    @Override
    public boolean isAvailable() {
        return !config.apiKey().isBlank() && circuitBreaker.getState() != CircuitBreaker.State.OPEN;
    }

    @Override
    protected void ensureReady() {
        if (config.apiKey().isBlank()) {
            throw new FatalAgentException("OpenRouter API key not configured (memoria.agents.openrouter.api-key)");
        }
    }

    @Override
    protected AgentReply query(SessionContext context, CancellationToken token, String prompt) {
        Supplier<String> call = () -> {
            token.throwIfCancelled();
            List<Message> messages = runtime.history().truncate(context.getConversationHistory()).stream()
                    .map(OpenRouterAgent::toMessage)
                    .toList();
            return client.chat(ChatRequest.extraction(client.modelName(), messages)).firstContent();
        };
        Supplier<String> decorated = Retry.decorateSupplier(retry,
                CircuitBreaker.decorateSupplier(circuitBreaker, call));

        try {
            return AgentReply.of(decorated.get());
        } catch (CallNotPermittedException e) {
            throw new TransientAgentException("OpenRouter circuit breaker is open", e);
        } catch (LlmClient.LlmException e) {
            if (Thread.currentThread().isInterrupted()) {
                throw new AgentCancelledException("Interrupted while calling OpenRouter");
            }
            if (e.isClientError()) {
                throw new FatalAgentException(e.getMessage(), e);
            }
            throw new TransientAgentException(e.getMessage(), e);
        }
    }

    private static Message toMessage(ConversationMessage message) {
        return message.role() == ConversationMessage.Role.ASSISTANT
                ? Message.assistant(message.content())
                : Message.user(message.content());
    }
}
