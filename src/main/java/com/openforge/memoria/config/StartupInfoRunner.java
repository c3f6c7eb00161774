package com.openforge.memoria.config;

import com.openforge.memoria.agent.AgentProperties;
import com.openforge.memoria.agent.AgentSelector;
import com.openforge.memoria.agent.ExtractionAgent;
import com.openforge.memoria.worker.RecoveryProperties;
import com.openforge.memoria.worker.WorkerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.stream.Collectors;

/**
 * Prints a structured startup summary after the application context is fully ready.
 *
 * Checks performed:
 *   - Database: opens a real JDBC connection and reads the server version
 *   - Agents: configured provider, availability of every agent, API keys masked
 *   - Worker and recovery policy
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StartupInfoRunner implements ApplicationRunner {

    private final DataSource         dataSource;
    private final AgentSelector      selector;
    private final AgentProperties    agentProperties;
    private final WorkerProperties   workerProperties;
    private final RecoveryProperties recoveryProperties;
    private final Environment        env;

    @Override
    public void run(ApplicationArguments args) {
        String dbStatus = probeDatabase();
        String port     = env.getProperty("server.port", "8080");
        String agents   = selector.all().stream()
                .map(agent -> agent.name() + (agent.isAvailable() ? " ✔" : " ✘"))
                .collect(Collectors.joining("  "));

        log.info("""

                ╔══════════════════════════════════════════════════════════╗
                ║              Memoria  —  Startup Summary                 ║
                ╠══════════════════════════════════════════════════════════╣
                ║  Server                                                  ║
                ║    HTTP Port      : {}
                ║    Java Version   : {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Database                                                ║
                ║    {}
                ╠══════════════════════════════════════════════════════════╣
                ║  Extraction Agents                                       ║
                ║    Provider       : {}  (selected: {})
                ║    Availability   : {}
                ║    Gemini         : {}  key={}
                ║    OpenRouter     : {}  key={}
                ╠══════════════════════════════════════════════════════════╣
                ║  Worker                                                  ║
                ║    Max retries    : {}   idle-timeout={}
                ║    Recovery       : every {}  stale-session={}  cap={}
                ╚══════════════════════════════════════════════════════════╝
                """,
                port,
                System.getProperty("java.version"),

                dbStatus,

                selector.configuredProvider(),
                selectedName(),
                agents,
                agentProperties.gemini().model(), maskKey(agentProperties.gemini().apiKey()),
                agentProperties.openrouter().model(), maskKey(agentProperties.openrouter().apiKey()),

                workerProperties.maxRetries(), workerProperties.idleTimeout(),
                recoveryProperties.interval(), recoveryProperties.staleSessionThreshold(),
                recoveryProperties.maxSessionsPerPass()
        );
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private String selectedName() {
        ExtractionAgent selected = selector.select();
        return selected.name();
    }

    /**
     * Opens a real JDBC connection and reads the DB server version.
     * Returns a one-line summary or error message.
     */
    private String probeDatabase() {
        try (Connection conn = dataSource.getConnection()) {
            String url     = conn.getMetaData().getURL();
            String version = conn.getMetaData().getDatabaseProductVersion();
            // Strip credentials from the JDBC URL for safe logging
            String safeUrl = url.replaceAll("password=[^&;]*", "password=***");
            return "✔ Connected  version=" + version + "  url=" + safeUrl;
        } catch (Exception e) {
            return "✘ FAILED — " + e.getMessage();
        }
    }

    /**
     * Masks an API key: shows first 6 chars + "..." + last 4 chars.
     */
    private static String maskKey(String key) {
        if (key == null || key.isBlank()) {
            return "(not set)";
        }
        if (key.length() <= 10) return "***";
        return key.substring(0, 6) + "..." + key.substring(key.length() - 4);
    }
}
