package com.openforge.memoria.session;

import com.openforge.memoria.domain.SdkSession;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Live, in-memory working state of one session's consumer.
 *
 * Owned by {@link SessionRegistry}; never persisted. Fields touched by the
 * consumer thread only (conversation history) are plain; fields read by the
 * recovery pass, the status broadcaster or the shutdown path are volatile or
 * concurrent.
 *
 * The consumer handle doubles as the "processor already running" lock: it is
 * only read and written while holding this object's monitor.
 */
@Getter
public class SessionContext {

    private final Long   sessionDbId;
    private final String contentSessionId;
    private final String project;
    private final long   startTime;

    @Setter private volatile String  userPrompt;
    @Setter private volatile int     lastPromptNumber;
    @Setter private volatile String  memorySessionId;
    @Setter private volatile Long    earliestPendingTimestamp;
    @Setter private volatile String  providerName;
    @Setter private volatile ProcessorState state = ProcessorState.IDLE;

    private final List<ConversationMessage> conversationHistory = new ArrayList<>();
    private final List<Long>                processingMessageIds = new CopyOnWriteArrayList<>();
    private final AtomicLong                cumulativeInputTokens  = new AtomicLong();
    private final AtomicLong                cumulativeOutputTokens = new AtomicLong();

    private volatile CancellationToken token = new CancellationToken();

    // guarded by this
    @Getter(AccessLevel.NONE) private Future<?> consumer;

    @Getter(AccessLevel.NONE) private final ReentrantLock workLock  = new ReentrantLock();
    @Getter(AccessLevel.NONE) private final Condition     workReady = workLock.newCondition();
    @Getter(AccessLevel.NONE) private boolean             workSignalled;

    public SessionContext(SdkSession session, long startTime) {
        this.sessionDbId      = session.getId();
        this.contentSessionId = session.getContentSessionId();
        this.project          = session.getProject();
        this.userPrompt       = session.getUserPrompt();
        this.lastPromptNumber = Math.max(1, session.getPromptCounter());
        this.memorySessionId  = session.getMemorySessionId();
        this.startTime        = startTime;
    }

    // ── Cancellation ─────────────────────────────────────────────────────────

    /** Replace the token for a new consumer run. The old token is never reused. */
    public synchronized CancellationToken renewToken() {
        this.token = new CancellationToken();
        return token;
    }

    // ── Consumer handle ──────────────────────────────────────────────────────

    public synchronized void setConsumer(Future<?> consumer) {
        this.consumer = consumer;
    }

    public synchronized boolean isConsumerRunning() {
        return consumer != null;
    }

    /**
     * Forget the claims of a previous run. Their rows stay {@code processing}
     * until the stale reset demotes them, so nothing is completed or failed here.
     */
    public void clearInFlight() {
        processingMessageIds.clear();
        earliestPendingTimestamp = null;
    }

    // ── Work signalling ──────────────────────────────────────────────────────

    /** Wake a consumer waiting in {@link #awaitWork(Duration)}. Never lost. */
    public void signalWork() {
        workLock.lock();
        try {
            workSignalled = true;
            workReady.signalAll();
        } finally {
            workLock.unlock();
        }
    }

    /**
     * Block until signalled or until {@code timeout} passes.
     *
     * @return true if woken by a signal
     */
    public boolean awaitWork(Duration timeout) throws InterruptedException {
        workLock.lock();
        try {
            if (!workSignalled) {
                workReady.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
            }
            boolean signalled = workSignalled;
            workSignalled = false;
            return signalled;
        } finally {
            workLock.unlock();
        }
    }

    // ── Token accounting ─────────────────────────────────────────────────────

    /** Split an estimated token count 70/30 into input/output counters. */
    public void addTokens(int tokensUsed) {
        cumulativeInputTokens.addAndGet((long) Math.floor(tokensUsed * 0.7));
        cumulativeOutputTokens.addAndGet((long) Math.floor(tokensUsed * 0.3));
    }
}
