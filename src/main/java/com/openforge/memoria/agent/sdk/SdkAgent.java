package com.openforge.memoria.agent.sdk;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
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
import com.openforge.memoria.session.SessionContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.File;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Primary agent: the {@code claude} CLI in print mode.
 *
 * Each prompt is one helper process. The provider keeps the conversation,
 * so follow-up prompts pass {@code --resume <id>} instead of replaying
 * history; the first provider session id becomes the memory-session id.
 *
 * A resume that the provider no longer recognises ("No conversation found")
 * surfaces as a terminated session, which moves the processor to the
 * fallback chain.
 */
@Slf4j
@Component
public class SdkAgent extends AbstractExtractionAgent {

    private static final String EXECUTABLE = "claude";
    private static final List<String> SYNTHETIC_PREFIXES =
            List.of(AgentSelector.GEMINI + "-", AgentSelector.OPENROUTER + "-", AgentSelector.CODEX + "-");

    private final AgentProperties.Cli config;
    private final CliProcessRunner    runner;
    private final ObjectMapper        objectMapper;

    /** sessionDbId → provider conversation to resume. */
    private final Map<Long, String> resumeIds = new ConcurrentHashMap<>();

    public SdkAgent(AgentRuntime runtime,
                    AgentProperties properties,
                    CliProcessRunner runner,
                    ObjectMapper objectMapper) {
        super(runtime);
        this.config       = properties.sdk();
        this.runner       = runner;
        this.objectMapper = objectMapper;
        runtime.registry().addRemovalListener(sessionDbId -> resumeIds.remove(sessionDbId));
    }

    @Override
    public String name() {
        return AgentSelector.CLAUDE;
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
        List<String> command = new ArrayList<>(List.of(executable().toString(), "-p", "--output-format", "json"));
        String resumeId = resumeIdFor(context);
        if (resumeId != null) {
            command.add("--resume");
            command.add(resumeId);
        }
        if (!config.model().isBlank()) {
            command.add("--model");
            command.add(config.model());
        }

        CliResult result = runner.run(context.getSessionDbId(), token, command, prompt,
                workingDir(), Map.of(), config.timeout());
        if (!result.succeeded()) {
            throw ErrorClassifier.classify(new RuntimeException("Claude CLI failed: " + result.detail()));
        }

        JsonNode json = parse(result.stdout());
        String text = json.path("result").asText("");
        if (json.path("is_error").asBoolean(false)) {
            throw ErrorClassifier.classify(new RuntimeException("Claude CLI reported an error: " + text));
        }
        String providerSessionId = json.path("session_id").asText(null);
        if (providerSessionId != null) {
            resumeIds.put(context.getSessionDbId(), providerSessionId);
        }
        log.debug("[Agent:claude] session={} replyLength={} providerSession={}",
                context.getSessionDbId(), text.length(), providerSessionId);
        return new AgentReply(text.trim(), providerSessionId);
    }

    private String resumeIdFor(SessionContext context) {
        String known = resumeIds.get(context.getSessionDbId());
        if (known != null) {
            return known;
        }
        String memoryId = context.getMemorySessionId();
        if (memoryId == null || SYNTHETIC_PREFIXES.stream().anyMatch(memoryId::startsWith)) {
            return null;
        }
        return memoryId;
    }

    private Path executable() {
        return ExecutableLocator.locate(config.executable(), EXECUTABLE)
                .orElseThrow(() -> new FatalAgentException(
                        "Claude executable not found. Add \"claude\" to PATH or set memoria.agents.sdk.executable"));
    }

    private File workingDir() {
        return config.workingDir().isBlank() ? null : Path.of(config.workingDir()).toFile();
    }

    private JsonNode parse(String stdout) {
        try {
            return objectMapper.readTree(stdout);
        } catch (JsonProcessingException e) {
            throw new TransientAgentException("Unparseable Claude CLI output: " + abbreviate(stdout), e);
        }
    }

    private static String abbreviate(String text) {
        return text.length() <= 200 ? text : text.substring(0, 200) + "…";
    }
}
