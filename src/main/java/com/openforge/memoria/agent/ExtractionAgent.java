package com.openforge.memoria.agent;

import com.openforge.memoria.session.CancellationToken;
import com.openforge.memoria.session.SessionContext;

/**
 * A pluggable provider that turns a session's queued messages into stored
 * observations and summaries.
 *
 * {@link #startSession} blocks the calling consumer thread until the
 * session's message sequence ends (queue idle or token cancelled). Failures
 * are reported as {@link AgentException} subclasses so the processor can
 * decide between fallback, restart and giving up.
 */
public interface ExtractionAgent {

    /** Stable provider name, e.g. "claude" or "gemini". */
    String name();

    /** False when the provider is unconfigured or its circuit breaker is open. */
    boolean isAvailable();

    /**
     * Drain the session's queue.
     *
     * @throws AgentCancelledException when {@code token} fires
     * @throws AgentException          for any provider failure
     */
    void startSession(SessionContext context, CancellationToken token);

    default int estimateTokens(String text) {
        return HistoryTruncator.estimateTokens(text);
    }
}
