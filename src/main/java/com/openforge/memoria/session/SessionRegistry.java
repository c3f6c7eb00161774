package com.openforge.memoria.session;

import com.openforge.memoria.domain.SdkSession;
import com.openforge.memoria.queue.PendingMessageStore;
import com.openforge.memoria.worker.WorkerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.LongConsumer;
import java.util.stream.Collectors;

/**
 * In-memory map of live session contexts, keyed by session row id.
 *
 * This is the single owner of {@link SessionContext} objects and of the
 * per-session cancellation tokens they carry. It is an ordinary bean passed
 * to its collaborators, so tests can build as many independent registries as
 * they like.
 *
 * At most one context exists per session id; {@link #register} rejects a
 * second one.
 */
@Slf4j
@Component
public class SessionRegistry {

    private final ConcurrentHashMap<Long, SessionContext> sessions = new ConcurrentHashMap<>();
    private final List<LongConsumer> removalListeners = new CopyOnWriteArrayList<>();

    private final SessionStore        sessionStore;
    private final PendingMessageStore messageStore;
    private final WorkerProperties    workerProperties;
    private final Clock               clock;

    public SessionRegistry(SessionStore sessionStore,
                           PendingMessageStore messageStore,
                           WorkerProperties workerProperties,
                           Clock clock) {
        this.sessionStore     = sessionStore;
        this.messageStore     = messageStore;
        this.workerProperties = workerProperties;
        this.clock            = clock;
    }

    // ── Lookup / creation ────────────────────────────────────────────────────

    /** Live context for a content-session id, loading the persisted row on first use. */
    public SessionContext getOrCreate(String contentSessionId) {
        SdkSession row = sessionStore.findByContentSessionId(contentSessionId)
                .orElseThrow(() -> new IllegalArgumentException(
                        "No session row for content session " + contentSessionId));
        return getOrCreate(row);
    }

    /** Live context for a session row id; used by the recovery pass. */
    public SessionContext initializeSession(Long sessionDbId) {
        SessionContext live = sessions.get(sessionDbId);
        if (live != null) {
            return live;
        }
        SdkSession row = sessionStore.findById(sessionDbId)
                .orElseThrow(() -> new IllegalArgumentException("No session row with id " + sessionDbId));
        return getOrCreate(row);
    }

    private SessionContext getOrCreate(SdkSession row) {
        return sessions.computeIfAbsent(row.getId(), id -> {
            log.info("[Registry] Initialized context for session {} ({})", id, row.getContentSessionId());
            return new SessionContext(row, clock.millis());
        });
    }

    /**
     * Register an externally built context.
     *
     * @throws IllegalStateException if a context for the same session is already live
     */
    public SessionContext register(SessionContext context) {
        SessionContext existing = sessions.putIfAbsent(context.getSessionDbId(), context);
        if (existing != null) {
            throw new IllegalStateException(
                    "A live context already exists for session " + context.getSessionDbId());
        }
        return context;
    }

    public Optional<SessionContext> get(Long sessionDbId) {
        return Optional.ofNullable(sessions.get(sessionDbId));
    }

    // ── Removal ──────────────────────────────────────────────────────────────

    /**
     * Drop the live context. Persisted rows are not touched. The context's
     * current token is cancelled so a consumer still attached to it stops.
     */
    public void remove(Long sessionDbId) {
        SessionContext removed = sessions.remove(sessionDbId);
        if (removed == null) {
            return;
        }
        removed.getToken().cancel("session removed from registry");
        removed.signalWork();
        log.info("[Registry] Removed session {}", sessionDbId);
        for (LongConsumer listener : removalListeners) {
            listener.accept(sessionDbId);
        }
    }

    public void addRemovalListener(LongConsumer listener) {
        removalListeners.add(listener);
    }

    /** True if {@code context} is still the registered context for its session. */
    public boolean isLive(SessionContext context) {
        return sessions.get(context.getSessionDbId()) == context;
    }

    // ── Message stream ───────────────────────────────────────────────────────

    /** FIFO sequence of claimed messages for one consumer run bound to {@code token}. */
    public MessageSequence messages(SessionContext context, CancellationToken token) {
        return new MessageSequence(context, token, messageStore, clock,
                workerProperties.pollInterval(), workerProperties.idleTimeout());
    }

    /** Wake the session's consumer, if any, because new work was enqueued. */
    public void notifyEnqueued(Long sessionDbId) {
        SessionContext context = sessions.get(sessionDbId);
        if (context != null) {
            context.signalWork();
        }
    }

    // ── Aggregates ───────────────────────────────────────────────────────────

    public Collection<SessionContext> all() {
        return List.copyOf(sessions.values());
    }

    public Set<Long> liveSessionIds() {
        return Set.copyOf(sessions.keySet());
    }

    public Set<Long> sessionsWithRunningConsumer() {
        return sessions.values().stream()
                .filter(SessionContext::isConsumerRunning)
                .map(SessionContext::getSessionDbId)
                .collect(Collectors.toUnmodifiableSet());
    }

    public int activeSessionCount() {
        return sessions.size();
    }

    public boolean isAnySessionProcessing() {
        return sessions.values().stream().anyMatch(SessionContext::isConsumerRunning);
    }
}
