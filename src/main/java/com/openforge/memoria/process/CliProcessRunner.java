package com.openforge.memoria.process;

import com.openforge.memoria.agent.AgentCancelledException;
import com.openforge.memoria.agent.FatalAgentException;
import com.openforge.memoria.agent.TransientAgentException;
import com.openforge.memoria.session.CancellationToken;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Runs one short-lived helper process per extraction call.
 *
 * The prompt is written to stdin; stdout and stderr are redirected to temp
 * files so a chatty helper can never block on a full pipe. The process is
 * registered with {@link ProcessRegistry} for its lifetime and killed when
 * the run's token is cancelled or the timeout passes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CliProcessRunner {

    private final ProcessRegistry processRegistry;

    public CliResult run(Long sessionDbId,
                         CancellationToken token,
                         List<String> command,
                         String stdin,
                         File workingDir,
                         Map<String, String> environment,
                         Duration timeout) {
        token.throwIfCancelled();
        Path stdoutFile = null;
        Path stderrFile = null;
        try {
            stdoutFile = Files.createTempFile("memoria-cli-", ".out");
            stderrFile = Files.createTempFile("memoria-cli-", ".err");

            ProcessBuilder builder = new ProcessBuilder(command)
                    .redirectOutput(stdoutFile.toFile())
                    .redirectError(stderrFile.toFile());
            if (workingDir != null) {
                builder.directory(workingDir);
            }
            builder.environment().putAll(environment);

            Process process = start(builder, command);
            processRegistry.register(sessionDbId, process);
            log.debug("[Cli] Spawned pid={} session={} command={}", process.pid(), sessionDbId, command.get(0));

            try (CancellationToken.Registration ignored = token.onCancel(process::destroyForcibly)) {
                try (OutputStream in = process.getOutputStream()) {
                    in.write(stdin.getBytes(StandardCharsets.UTF_8));
                } catch (IOException e) {
                    // the helper may exit before reading its input; its exit code tells the story
                    log.debug("[Cli] pid={} closed stdin early: {}", process.pid(), e.getMessage());
                }

                boolean exited = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
                if (token.isCancelled()) {
                    process.destroyForcibly();
                    throw new AgentCancelledException("Helper process cancelled: " + token.reason());
                }
                if (!exited) {
                    process.destroyForcibly();
                    throw new TransientAgentException(
                            "Helper process %s timed out after %s".formatted(command.get(0), timeout));
                }
                return new CliResult(process.exitValue(),
                        Files.readString(stdoutFile, StandardCharsets.UTF_8),
                        Files.readString(stderrFile, StandardCharsets.UTF_8));
            } finally {
                processRegistry.unregister(process);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AgentCancelledException("Interrupted while waiting for " + command.get(0));
        } catch (IOException e) {
            throw new TransientAgentException("I/O error running " + command.get(0) + ": " + e.getMessage(), e);
        } finally {
            deleteQuietly(stdoutFile);
            deleteQuietly(stderrFile);
        }
    }

    private static Process start(ProcessBuilder builder, List<String> command) {
        try {
            return builder.start();
        } catch (IOException e) {
            // launch failures (ENOENT, EACCES) never fix themselves
            throw new FatalAgentException(
                    "Executable not found or not runnable: %s (%s)".formatted(command.get(0), e.getMessage()), e);
        }
    }

    private static void deleteQuietly(Path path) {
        if (path == null) return;
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.debug("[Cli] Could not delete temp file {}: {}", path, e.getMessage());
        }
    }
}
