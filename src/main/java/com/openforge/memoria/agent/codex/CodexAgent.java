package com.openforge.memoria.agent.codex;

import com.openforge.memoria.agent.AbstractExtractionAgent;
import com.openforge.memoria.agent.AgentProperties;
import com.openforge.memoria.agent.AgentReply;
import com.openforge.memoria.agent.AgentRuntime;
import com.openforge.memoria.agent.AgentSelector;
import com.openforge.memoria.agent.ErrorClassifier;
import com.openforge.memoria.agent.FatalAgentException;
import com.openforge.memoria.agent.TransientAgentException;
import com.openforge.memoria.process.CliProcessRunner;
import com.openforge.memoria.process.CliResult;
import com.openforge.memoria.process.ExecutableLocator;
import com.openforge.memoria.session.CancellationToken;
import com.openforge.memoria.session.ConversationMessage;
import com.openforge.memoria.session.SessionContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Stateless agent backed by {@code codex exec}.
 *
 * The CLI keeps no conversation, so the truncated history is replayed as a
 * single transcript on stdin for every call, and the answer is read from
 * the file named by {@code --output-last-message}.
 */
@Slf4j
@Component
public class CodexAgent extends AbstractExtractionAgent {

    private static final String EXECUTABLE = "codex";

    private final AgentProperties.Cli config;
    private final CliProcessRunner    runner;

    public CodexAgent(AgentRuntime runtime, AgentProperties properties, CliProcessRunner runner) {
        super(runtime);
        this.config    = properties.codex();
        this.runner    = runner;
    }

    @Override
    public String name() {
        return AgentSelector.CODEX;
    }

    @Override
    public boolean isAvailable() {
        return ExecutableLocator.locate(config.executable(), EXECUTABLE).isPresent();
    }

    @Override
    protected void ensureReady() {
        executable();
    }

    @Override
    protected AgentReply query(SessionContext context, CancellationToken token, String prompt) {
        String transcript = format(runtime.history().truncate(context.getConversationHistory()));
        Path tempDir = null;
        try {
            tempDir = Files.createTempDirectory("memoria-codex-");
            Path outputFile = tempDir.resolve("last-message.txt");
            Path workDir = observerDir();

            List<String> command = List.of(executable().toString(),
                    "exec",
                    "--skip-git-repo-check",
                    "--sandbox", "read-only",
                    "--output-last-message", outputFile.toString(),
                    "-C", workDir.toString(),
                    "-");
            CliResult result = runner.run(context.getSessionDbId(), token, command, transcript,
                    null, Map.of(), config.timeout());

            if (!result.succeeded()) {
                throw ErrorClassifier.classify(new RuntimeException("Codex CLI failed: " + result.detail()));
            }
            if (!Files.exists(outputFile)) {
                throw new TransientAgentException("Codex CLI produced no output: " + result.detail());
            }
            return AgentReply.of(Files.readString(outputFile, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new TransientAgentException("Codex I/O error: " + e.getMessage(), e);
        } finally {
            deleteRecursively(tempDir);
        }
    }

    static String format(List<ConversationMessage> history) {
        return history.stream()
                .map(m -> (m.role() == ConversationMessage.Role.ASSISTANT ? "Assistant" : "User") + ":\n" + m.content())
                .collect(Collectors.joining("\n\n"));
    }

    private Path executable() {
        return ExecutableLocator.locate(config.executable(), EXECUTABLE)
                .orElseThrow(() -> new FatalAgentException(
                        "Codex executable not found. Add \"codex\" to PATH or set memoria.agents.codex.executable"));
    }

    private Path observerDir() throws IOException {
        Path dir = config.workingDir().isBlank()
                ? Path.of(System.getProperty("user.home"), ".memoria", "observer-sessions")
                : Path.of(config.workingDir());
        return Files.createDirectories(dir);
    }

    private static void deleteRecursively(Path dir) {
        if (dir == null) return;
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        } catch (IOException | UncheckedIOException e) {
            log.debug("[Agent:codex] Could not clean up {}: {}", dir, e.getMessage());
        }
    }
}
