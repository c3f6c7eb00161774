package com.openforge.memoria.worker;

import com.openforge.memoria.agent.AgentException;
import com.openforge.memoria.agent.AgentSelector;
import com.openforge.memoria.agent.ErrorClassifier;
import com.openforge.memoria.agent.ExtractionAgent;
import com.openforge.memoria.agent.FailureKind;
import com.openforge.memoria.event.WorkerEvent;
import com.openforge.memoria.event.WorkerEventPublisher;
import com.openforge.memoria.queue.FailOutcome;
import com.openforge.memoria.queue.PendingMessageStore;
import com.openforge.memoria.session.CancellationToken;
import com.openforge.memoria.session.ProcessorState;
import com.openforge.memoria.session.SessionContext;
import com.openforge.memoria.session.SessionRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.BooleanSupplier;

/**
 * Drives one consumer task per session.
 *
 * State machine, per session context:
 *
 *   idle ──start──▶ running
 *   running ──drained──────────▶ completed
 *   running ──fatal────────────▶ failed      (never restarted)
 *   running ──cancelled────────▶ cancelled   (never restarted)
 *   running ──transient────────▶ failed      (restartable)
 *   running ──session lost─────▶ fallback chain ──▶ completed | abandoned
 *
 * When a restartable run ends, a single read of the session's pending count
 * decides whether a new consumer is started with a fresh token. The read and
 * the restart happen under the context monitor, the same lock
 * {@link #start} takes for enqueue-triggered starts, so the two paths cannot
 * both start a consumer. A message enqueued after the read but before the
 * consumer handle is cleared sees a running consumer and is picked up by the
 * next enqueue or recovery pass.
 *
 * Message failures during a run go through {@link PendingMessageStore#fail},
 * whose per-message retry cap is independent of these restarts. Claims are
 * per run: a cancelled run, and every new start, drops the claimed ids
 * without touching their rows; the stale reset puts them back in the queue.
 */
@Slf4j
@Service
public class SessionProcessor {

    private final SessionRegistry         registry;
    private final PendingMessageStore     messageStore;
    private final AgentSelector           selector;
    private final ProcessingStatusService statusService;
    private final WorkerEventPublisher    publisher;
    private final ExecutorService         executor;
    private final Clock                   clock;

    private volatile boolean accepting;

    public SessionProcessor(SessionRegistry registry,
                            PendingMessageStore messageStore,
                            AgentSelector selector,
                            ProcessingStatusService statusService,
                            WorkerEventPublisher publisher,
                            @Qualifier("sessionProcessorExecutor") ExecutorService executor,
                            Clock clock) {
        this.registry      = registry;
        this.messageStore  = messageStore;
        this.selector      = selector;
        this.statusService = statusService;
        this.publisher     = publisher;
        this.executor      = executor;
        this.clock         = clock;
    }

    // ── Start ────────────────────────────────────────────────────────────────

    /**
     * Attach a consumer to the session unless one is already running.
     *
     * @param trigger short label for logs: "enqueue", "recovery", "restart"
     * @return true if a new consumer was started
     */
    public boolean start(SessionContext context, String trigger) {
        synchronized (context) {
            if (!accepting) {
                log.debug("[Processor:{}] Not accepting work, start ignored trigger={}",
                        context.getSessionDbId(), trigger);
                return false;
            }
            if (context.isConsumerRunning() || !registry.isLive(context)) {
                return false;
            }
            CancellationToken token = context.renewToken();
            context.clearInFlight();
            token.onCancel(context::signalWork);
            context.setState(ProcessorState.RUNNING);
            try {
                Future<?> consumer = executor.submit(() -> runConsumer(context, token));
                context.setConsumer(consumer);
            } catch (RejectedExecutionException e) {
                context.setState(ProcessorState.IDLE);
                log.warn("[Processor:{}] Executor rejected consumer trigger={}: {}",
                        context.getSessionDbId(), trigger, e.getMessage());
                return false;
            }
            log.info("[Processor:{}] Consumer started trigger={}", context.getSessionDbId(), trigger);
            return true;
        }
    }

    // ── Consumer run ─────────────────────────────────────────────────────────

    private void runConsumer(SessionContext context, CancellationToken token) {
        Outcome outcome = Outcome.TRANSIENT;
        try {
            outcome = drive(context, token);
        } catch (RuntimeException e) {
            log.error("[Processor:{}] Unexpected consumer failure", context.getSessionDbId(), e);
        } finally {
            finish(context, outcome);
        }
    }

    private Outcome drive(SessionContext context, CancellationToken token) {
        ExtractionAgent agent = selector.select();
        AgentException failure = attempt(agent, context, token);
        if (failure == null) {
            return Outcome.DRAINED;
        }
        if (failure.kind() == FailureKind.SESSION_TERMINATED) {
            log.warn("[Processor:{}] Provider session lost on {}: {}",
                    context.getSessionDbId(), agent.name(), failure.getMessage());
            failInFlight(context);
            return fallBack(context, token, agent, failure);
        }
        return afterFailure(context, agent, failure);
    }

    /** @return null on a normal return, the classified failure otherwise */
    private AgentException attempt(ExtractionAgent agent, SessionContext context, CancellationToken token) {
        context.setProviderName(agent.name());
        try {
            agent.startSession(context, token);
            return null;
        } catch (RuntimeException e) {
            return ErrorClassifier.classify(e);
        }
    }

    private Outcome afterFailure(SessionContext context, ExtractionAgent agent, AgentException failure) {
        switch (failure.kind()) {
            case CANCELLED -> {
                log.info("[Processor:{}] Consumer cancelled provider={}: {}",
                        context.getSessionDbId(), agent.name(), failure.getMessage());
                return Outcome.CANCELLED;
            }
            case FATAL -> {
                log.error("[Processor:{}] Unrecoverable error on {}, not restarting",
                        context.getSessionDbId(), agent.name(), failure);
                failInFlight(context);
                return Outcome.FATAL;
            }
            default -> {
                log.warn("[Processor:{}] Transient error on {}: {}",
                        context.getSessionDbId(), agent.name(), failure.getMessage());
                failInFlight(context);
                return Outcome.TRANSIENT;
            }
        }
    }

    private Outcome fallBack(SessionContext context, CancellationToken token,
                             ExtractionAgent failed, AgentException cause) {
        AgentException lastFailure = cause;
        for (ExtractionAgent next : selector.fallbackChain(failed)) {
            if (token.isCancelled()) {
                return Outcome.CANCELLED;
            }
            if (!next.isAvailable()) {
                log.info("[Processor:{}] Fallback {} unavailable, skipping", context.getSessionDbId(), next.name());
                continue;
            }
            log.warn("[Processor:{}] Falling back from {} to {} historyLength={}",
                    context.getSessionDbId(), failed.name(), next.name(), context.getConversationHistory().size());
            AgentException failure = attempt(next, context, token);
            if (failure == null) {
                return Outcome.DRAINED;
            }
            if (failure.kind() == FailureKind.CANCELLED) {
                return Outcome.CANCELLED;
            }
            log.warn("[Processor:{}] Fallback {} failed ({}): {}",
                    context.getSessionDbId(), next.name(), failure.kind(), failure.getMessage());
            failInFlight(context);
            lastFailure = failure;
        }
        abandon(context, lastFailure);
        return Outcome.ABANDONED;
    }

    private void failInFlight(SessionContext context) {
        List<Long> inFlight = List.copyOf(context.getProcessingMessageIds());
        for (Long messageId : inFlight) {
            FailOutcome result = messageStore.fail(messageId);
            log.debug("[Processor:{}] Message {} failed outcome={}", context.getSessionDbId(), messageId, result);
        }
        context.getProcessingMessageIds().removeAll(inFlight);
        context.setEarliestPendingTimestamp(null);
    }

    private void abandon(SessionContext context, AgentException cause) {
        int abandoned = messageStore.markAllAbandoned(context.getSessionDbId());
        context.getProcessingMessageIds().clear();
        log.warn("[Processor:{}] All agents failed, abandoned {} message(s): {}",
                context.getSessionDbId(), abandoned, cause.getMessage());
        publisher.publish(WorkerEvent.sessionAbandoned(context.getSessionDbId(), cause.getMessage(),
                abandoned, clock.millis()));
        registry.remove(context.getSessionDbId());
    }

    private void finish(SessionContext context, Outcome outcome) {
        boolean restarted = false;
        synchronized (context) {
            context.setConsumer(null);
            context.setState(outcome.state);
            if (outcome == Outcome.CANCELLED) {
                context.clearInFlight();
            }
            if (outcome.restartable && accepting && registry.isLive(context)) {
                long pending = messageStore.pendingCount(context.getSessionDbId());
                if (pending > 0) {
                    log.info("[Processor:{}] {} pending message(s) after {}, restarting with a fresh token",
                            context.getSessionDbId(), pending, outcome);
                    restarted = start(context, "restart");
                }
            }
        }
        if (!restarted) {
            log.info("[Processor:{}] Consumer finished outcome={} provider={}",
                    context.getSessionDbId(), outcome, context.getProviderName());
        }
        statusService.broadcast();
    }

    // ── Shutdown support ─────────────────────────────────────────────────────

    public boolean isAccepting() {
        return accepting;
    }

    public void setAccepting(boolean accepting) {
        this.accepting = accepting;
    }

    /** Cancel the running consumer of every live session. */
    public void cancelAll(String reason) {
        for (SessionContext context : registry.all()) {
            context.getToken().cancel(reason);
        }
    }

    /**
     * Wait until no consumer holds a claimed message, or until {@code timeout}.
     *
     * @return true if everything in flight finished in time
     */
    public boolean awaitInFlight(Duration timeout) throws InterruptedException {
        return awaitCondition(timeout, () -> registry.all().stream()
                .allMatch(context -> context.getProcessingMessageIds().isEmpty()));
    }

    /** Wait until every consumer task has returned, or until {@code timeout}. */
    public boolean awaitConsumers(Duration timeout) throws InterruptedException {
        return awaitCondition(timeout, () -> !registry.isAnySessionProcessing());
    }

    private boolean awaitCondition(Duration timeout, BooleanSupplier condition)
            throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() >= deadline) {
                return false;
            }
            Thread.sleep(50);
        }
        return true;
    }

    private enum Outcome {
        DRAINED(ProcessorState.COMPLETED, true),
        TRANSIENT(ProcessorState.FAILED, true),
        FATAL(ProcessorState.FAILED, false),
        CANCELLED(ProcessorState.CANCELLED, false),
        ABANDONED(ProcessorState.FAILED, false);

        private final ProcessorState state;
        private final boolean        restartable;

        Outcome(ProcessorState state, boolean restartable) {
            this.state       = state;
            this.restartable = restartable;
        }
    }
}
