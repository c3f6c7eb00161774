package com.openforge.memoria.agent.openrouter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.memoria.agent.AgentProperties;
import com.openforge.memoria.agent.AgentRuntime;
import com.openforge.memoria.agent.FatalAgentException;
import com.openforge.memoria.agent.HistoryTruncator;
import com.openforge.memoria.agent.TransientAgentException;
import com.openforge.memoria.config.AppConfig;
import com.openforge.memoria.config.Resilience4jConfig;
import com.openforge.memoria.session.CancellationToken;
import com.openforge.memoria.session.ConversationMessage;
import com.openforge.memoria.session.SessionContext;
import com.openforge.memoria.session.SessionRegistry;
import com.openforge.memoria.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class OpenRouterAgentTest {

    private final Resilience4jConfig resilience = new Resilience4jConfig();
    private final ObjectMapper objectMapper = new AppConfig().objectMapper();

    private HttpClient httpClient;
    private HttpResponse<String> response;
    private SessionContext context;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() throws Exception {
        httpClient = mock(HttpClient.class);
        response = mock(HttpResponse.class);
        doReturn(response).when(httpClient).send(any(), any());
        context = new SessionContext(TestFixtures.sessionRow(1L, "c-1"), 0L);
        context.getConversationHistory().add(ConversationMessage.user("init"));
        context.getConversationHistory().add(ConversationMessage.assistant("ready"));
        context.getConversationHistory().add(ConversationMessage.user("<tool_used/>"));
    }

    @Test
    void firstChoiceIsReturnedAndAttributionHeadersAreSent() throws Exception {
        when(response.statusCode()).thenReturn(200);
        when(response.body()).thenReturn("""
                {"id":"gen-1","object":"chat.completion","model":"m",
                 "choices":[{"index":0,"message":{"role":"assistant","content":"<observation/>"},"finish_reason":"stop"}],
                 "usage":{"prompt_tokens":10,"completion_tokens":3,"total_tokens":13}}
                """);

        String text = agent("key").query(context, new CancellationToken(), "<tool_used/>").text();

        assertThat(text).isEqualTo("<observation/>");
        ArgumentCaptor<HttpRequest> request = ArgumentCaptor.forClass(HttpRequest.class);
        verify(httpClient).send(request.capture(), any());
        assertThat(request.getValue().uri().toString()).isEqualTo("https://openrouter.test/api/v1/chat/completions");
        assertThat(request.getValue().headers().firstValue("Authorization")).hasValue("Bearer key");
        assertThat(request.getValue().headers().firstValue("HTTP-Referer")).hasValue("https://memoria.test");
        assertThat(request.getValue().headers().firstValue("X-Title")).hasValue("memoria");
    }

    @Test
    void unauthorizedIsFatalAndNotRetried() throws Exception {
        when(response.statusCode()).thenReturn(401);
        when(response.body()).thenReturn("{\"error\":\"invalid key\"}");

        assertThatThrownBy(() -> agent("key").query(context, new CancellationToken(), "prompt"))
                .isInstanceOf(FatalAgentException.class);
        verify(httpClient, times(1)).send(any(), any());
    }

    @Test
    void rateLimitIsRetriedThenTransient() throws Exception {
        when(response.statusCode()).thenReturn(429);
        when(response.body()).thenReturn("slow down");

        assertThatThrownBy(() -> agent("key").query(context, new CancellationToken(), "prompt"))
                .isInstanceOf(TransientAgentException.class);
        verify(httpClient, times(3)).send(any(), any());
    }

    @Test
    void missingApiKeyIsUnavailable() {
        assertThat(agent("").isAvailable()).isFalse();
        assertThat(agent("key").isAvailable()).isTrue();
    }

    private OpenRouterAgent agent(String apiKey) {
        AgentProperties properties = new AgentProperties(null, null, null,
                new AgentProperties.OpenRouter(apiKey, "xiaomi/mimo-v2-flash:free", "https://openrouter.test/api/v1",
                        "https://memoria.test", "memoria", 30),
                new AgentProperties.History(20, 100_000));
        AgentRuntime runtime = new AgentRuntime(mock(SessionRegistry.class), null, null, null,
                new HistoryTruncator(20, 100_000), Clock.systemUTC());
        return new OpenRouterAgent(runtime, properties, httpClient, objectMapper,
                resilience.circuitBreakerRegistry(), resilience.retryRegistry());
    }
}
