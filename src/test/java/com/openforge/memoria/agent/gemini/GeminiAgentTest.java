package com.openforge.memoria.agent.gemini;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.memoria.agent.AgentProperties;
import com.openforge.memoria.agent.AgentRuntime;
import com.openforge.memoria.agent.FatalAgentException;
import com.openforge.memoria.agent.HistoryTruncator;
import com.openforge.memoria.agent.TransientAgentException;
import com.openforge.memoria.config.Resilience4jConfig;
import com.openforge.memoria.session.CancellationToken;
import com.openforge.memoria.session.ConversationMessage;
import com.openforge.memoria.session.SessionContext;
import com.openforge.memoria.session.SessionRegistry;
import com.openforge.memoria.support.TestFixtures;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GeminiAgentTest {

    private final Resilience4jConfig resilience = new Resilience4jConfig();

    private HttpClient httpClient;
    private HttpResponse<String> response;
    private CircuitBreakerRegistry circuitBreakers;
    private SessionContext context;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() throws Exception {
        httpClient = mock(HttpClient.class);
        response = mock(HttpResponse.class);
        doReturn(response).when(httpClient).send(any(), any());
        circuitBreakers = resilience.circuitBreakerRegistry();
        context = new SessionContext(TestFixtures.sessionRow(1L, "c-1"), 0L);
        context.getConversationHistory().add(ConversationMessage.user("<tool_used/>"));
    }

    @Test
    void replyTextIsReturned() {
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("{\"candidates\":[{\"content\":{\"parts\":[{\"text\":\" done \"}]}}]}");

        assertThat(agent("key").query(context, new CancellationToken(), "<tool_used/>").text()).isEqualTo("done");
    }

    @Test
    void transientFailuresAreRetriedThenReported() throws Exception {
        when(response.statusCode()).thenReturn(503);
        when(response.body()).thenReturn("overloaded");

        assertThatThrownBy(() -> agent("key").query(context, new CancellationToken(), "prompt"))
                .isInstanceOf(TransientAgentException.class);
        verify(httpClient, times(3)).send(any(), any());
    }

    @Test
    void rejectedRequestIsNotRetried() throws Exception {
        when(response.statusCode()).thenReturn(403);
        when(response.body()).thenReturn("forbidden");

        assertThatThrownBy(() -> agent("key").query(context, new CancellationToken(), "prompt"))
                .isInstanceOf(FatalAgentException.class);
        verify(httpClient, times(1)).send(any(), any());
    }

    @Test
    void openBreakerMakesTheAgentUnavailable() throws Exception {
        GeminiAgent agent = agent("key");
        assertThat(agent.isAvailable()).isTrue();

        circuitBreakers.circuitBreaker(GeminiAgent.RESILIENCE_NAME).transitionToOpenState();

        assertThat(agent.isAvailable()).isFalse();
        assertThatThrownBy(() -> agent.query(context, new CancellationToken(), "prompt"))
                .isInstanceOf(TransientAgentException.class)
                .hasMessageContaining("circuit breaker is open");
        verify(httpClient, never()).send(any(), any());
    }

    @Test
    void missingApiKeyIsUnavailableAndFatal() {
        GeminiAgent agent = agent("");

        assertThat(agent.isAvailable()).isFalse();
        assertThatThrownBy(() -> agent.startSession(context, new CancellationToken()))
                .isInstanceOf(FatalAgentException.class);
    }

    private GeminiAgent agent(String apiKey) {
        AgentProperties properties = new AgentProperties(null, null,
                new AgentProperties.Gemini(apiKey, "gemini-2.5-flash-lite", "https://gemini.test/v1beta", false, 30),
                null, new AgentProperties.History(20, 100_000));
        AgentRuntime runtime = new AgentRuntime(mock(SessionRegistry.class), null, null, null,
                new HistoryTruncator(20, 100_000), Clock.systemUTC());
        return new GeminiAgent(runtime, properties, httpClient, new ObjectMapper(), circuitBreakers,
                resilience.retryRegistry(), resilience.rateLimiterRegistry());
    }
}
