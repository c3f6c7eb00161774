package com.openforge.memoria.agent;

import java.io.InterruptedIOException;
import java.nio.file.NoSuchFileException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CancellationException;

/**
 * Maps arbitrary throwables onto the agent failure taxonomy.
 *
 * Typed {@link AgentException}s pass through unchanged. Anything else is
 * classified by message: helper-process launch failures are fatal, messages
 * that say the provider conversation is gone are session-terminated, and
 * everything else is transient.
 */
public final class ErrorClassifier {

    private static final List<String> UNRECOVERABLE_PATTERNS = List.of(
            "executable not found",
            "claude_code_path",
            "codex_path",
            "enoent",
            "error=2,",
            "spawn",
            "invalid api key",
            "api key not valid"
    );

    private static final List<String> TERMINATED_PATTERNS = List.of(
            "process aborted by user",
            "processtransport",
            "not ready for writing",
            "session generator failed",
            "claude code process",
            "no conversation found"
    );

    private ErrorClassifier() {
    }

    public static AgentException classify(Throwable error) {
        if (error instanceof AgentException agentException) {
            return agentException;
        }
        if (error instanceof CancellationException || error instanceof InterruptedException
                || error instanceof InterruptedIOException) {
            AgentCancelledException cancelled = new AgentCancelledException(describe(error));
            cancelled.initCause(error);
            return cancelled;
        }
        if (error instanceof NoSuchFileException) {
            return new FatalAgentException(describe(error), error);
        }
        String message = describe(error).toLowerCase(Locale.ROOT);
        if (matches(message, UNRECOVERABLE_PATTERNS)) {
            return new FatalAgentException(describe(error), error);
        }
        if (matches(message, TERMINATED_PATTERNS)) {
            return new SessionTerminatedException(describe(error), error);
        }
        return new TransientAgentException(describe(error), error);
    }

    private static boolean matches(String message, List<String> patterns) {
        for (String pattern : patterns) {
            if (message.contains(pattern)) return true;
        }
        return false;
    }

    private static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getSimpleName() : message;
    }
}
