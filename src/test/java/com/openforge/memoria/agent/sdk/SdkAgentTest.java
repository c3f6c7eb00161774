package com.openforge.memoria.agent.sdk;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.memoria.agent.AgentException;
import com.openforge.memoria.agent.AgentProperties;
import com.openforge.memoria.agent.AgentReply;
import com.openforge.memoria.agent.AgentRuntime;
import com.openforge.memoria.agent.FailureKind;
import com.openforge.memoria.agent.FatalAgentException;
import com.openforge.memoria.agent.HistoryTruncator;
import com.openforge.memoria.process.CliProcessRunner;
import com.openforge.memoria.process.ProcessRegistry;
import com.openforge.memoria.session.CancellationToken;
import com.openforge.memoria.session.SessionContext;
import com.openforge.memoria.session.SessionRegistry;
import com.openforge.memoria.support.TestFixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Clock;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

@EnabledOnOs({OS.LINUX, OS.MAC})
class SdkAgentTest {

    @TempDir Path tempDir;

    @Test
    void firstReplyCarriesTheProviderSessionAndLaterPromptsResumeIt() throws IOException {
        SdkAgent agent = agent(script("""
                cat > /dev/null
                printf '{"type":"result","is_error":false,"result":"args: %s","session_id":"sdk-123"}' "$*"
                """));
        SessionContext context = context(null);

        AgentReply first = agent.query(context, new CancellationToken(), "prompt one");
        AgentReply second = agent.query(context, new CancellationToken(), "prompt two");

        assertThat(first.providerSessionId()).isEqualTo("sdk-123");
        assertThat(first.text()).isEqualTo("args: -p --output-format json");
        assertThat(second.text()).contains("--resume sdk-123");
    }

    @Test
    void syntheticMemorySessionIdIsNeverResumed() throws IOException {
        SdkAgent agent = agent(script("""
                cat > /dev/null
                printf '{"is_error":false,"result":"args: %s"}' "$*"
                """));

        AgentReply reply = agent.query(context("gemini-c-1-1700000000000"), new CancellationToken(), "prompt");

        assertThat(reply.text()).doesNotContain("--resume");
        assertThat(reply.providerSessionId()).isNull();
    }

    @Test
    void realMemorySessionIdIsResumedAfterARestart() throws IOException {
        SdkAgent agent = agent(script("""
                cat > /dev/null
                printf '{"is_error":false,"result":"args: %s"}' "$*"
                """));

        AgentReply reply = agent.query(context("sdk-777"), new CancellationToken(), "prompt");

        assertThat(reply.text()).contains("--resume sdk-777");
    }

    @Test
    void lostConversationIsSessionTerminated() throws IOException {
        SdkAgent agent = agent(script("""
                cat > /dev/null
                echo "No conversation found with session ID: sdk-123" >&2
                exit 1
                """));

        assertThatThrownBy(() -> agent.query(context("sdk-123"), new CancellationToken(), "prompt"))
                .isInstanceOfSatisfying(AgentException.class,
                        e -> assertThat(e.kind()).isEqualTo(FailureKind.SESSION_TERMINATED));
    }

    @Test
    void errorResultIsTransient() throws IOException {
        SdkAgent agent = agent(script("""
                cat > /dev/null
                printf '{"is_error":true,"result":"overloaded"}'
                """));

        assertThatThrownBy(() -> agent.query(context(null), new CancellationToken(), "prompt"))
                .isInstanceOfSatisfying(AgentException.class,
                        e -> assertThat(e.kind()).isEqualTo(FailureKind.TRANSIENT));
    }

    @Test
    void missingExecutableIsFatalBeforeAnyPromptIsSent() {
        SdkAgent agent = agent(tempDir.resolve("no-such-claude").toString());
        SessionContext context = context(null);

        assertThat(agent.isAvailable()).isFalse();
        assertThatThrownBy(() -> agent.startSession(context, new CancellationToken()))
                .isInstanceOf(FatalAgentException.class)
                .hasMessageContaining("Claude executable not found");
        assertThat(context.getConversationHistory()).isEmpty();
    }

    private SdkAgent agent(String executable) {
        AgentRuntime runtime = new AgentRuntime(mock(SessionRegistry.class), null, null, null,
                new HistoryTruncator(20, 100_000), Clock.systemUTC());
        AgentProperties properties = new AgentProperties(
                new AgentProperties.Cli(executable, "", "", Duration.ofSeconds(10)),
                null, null, null, null);
        return new SdkAgent(runtime, properties, new CliProcessRunner(new ProcessRegistry()), new ObjectMapper());
    }

    private String script(String body) throws IOException {
        Path script = tempDir.resolve("claude");
        Files.writeString(script, "#!/bin/sh\n" + body, StandardCharsets.UTF_8);
        Files.setPosixFilePermissions(script, PosixFilePermissions.fromString("rwx------"));
        return script.toString();
    }

    private static SessionContext context(String memorySessionId) {
        SessionContext context = new SessionContext(TestFixtures.sessionRow(1L, "c-1"), 0L);
        context.setMemorySessionId(memorySessionId);
        return context;
    }
}
