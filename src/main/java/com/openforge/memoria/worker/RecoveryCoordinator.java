package com.openforge.memoria.worker;

import com.openforge.memoria.process.ProcessRegistry;
import com.openforge.memoria.queue.PendingMessageStore;
import com.openforge.memoria.session.SessionContext;
import com.openforge.memoria.session.SessionRegistry;
import com.openforge.memoria.session.SessionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;

/**
 * Makes sure no queued message is silently lost across crashes and restarts.
 *
 * A pass runs four steps in order:
 *   1. stale in-flight reset   processing → pending
 *   2. stale session failure   old active sessions → failed, their pending messages → failed
 *   3. orphan reaping          kill helper processes of sessions no longer registered
 *   4. auto-recovery           start consumers for undrained queues, capped and paced
 *
 * The cold-start pass reclaims every processing row; periodic passes only
 * reclaim claims older than the stale-processing threshold so that live
 * calls are left alone.
 */
@Slf4j
@Service
public class RecoveryCoordinator {

    private final PendingMessageStore messageStore;
    private final SessionStore        sessionStore;
    private final SessionRegistry     registry;
    private final SessionProcessor    processor;
    private final ProcessRegistry     processRegistry;
    private final ProcessingStatusService statusService;
    private final RecoveryProperties  properties;

    public RecoveryCoordinator(PendingMessageStore messageStore,
                               SessionStore sessionStore,
                               SessionRegistry registry,
                               SessionProcessor processor,
                               ProcessRegistry processRegistry,
                               ProcessingStatusService statusService,
                               RecoveryProperties properties) {
        this.messageStore    = messageStore;
        this.sessionStore    = sessionStore;
        this.registry        = registry;
        this.processor       = processor;
        this.processRegistry = processRegistry;
        this.statusService   = statusService;
        this.properties      = properties;
    }

    /**
     * Demote every processing row to pending. Must run before any consumer
     * is allowed to claim work after an unclean shutdown.
     */
    public int resetAllInFlight() {
        int reset = messageStore.resetStaleProcessing(0);
        if (reset > 0) {
            log.info("[Recovery] Cold start reclaimed {} in-flight message(s)", reset);
        }
        return reset;
    }

    /** Remaining cold-start steps, run once the processor accepts work. */
    public RecoveryResult runStartupPass(int alreadyReset) {
        RecoveryResult result = runSteps(alreadyReset);
        log.info("[Recovery] Startup pass {}", result);
        return result;
    }

    @Scheduled(initialDelayString = "${memoria.recovery.interval:5m}",
               fixedDelayString   = "${memoria.recovery.interval:5m}")
    public void scheduledPass() {
        if (!processor.isAccepting()) {
            log.debug("[Recovery] Worker not accepting work, periodic pass skipped");
            return;
        }
        try {
            RecoveryResult result = runPass();
            log.info("[Recovery] Periodic pass {}", result);
        } catch (RuntimeException e) {
            log.error("[Recovery] Periodic pass failed", e);
        }
    }

    /** A full periodic pass; also exposed through the admin API. */
    public RecoveryResult runPass() {
        int reset = messageStore.resetStaleProcessing(properties.staleProcessingThreshold().toMillis());
        return runSteps(reset);
    }

    private RecoveryResult runSteps(int resetMessages) {
        // 2. stale sessions
        Set<Long> running = registry.sessionsWithRunningConsumer();
        List<Long> staleSessions = sessionStore.failStaleSessions(properties.staleSessionThreshold(), running);
        int failedMessages = messageStore.failPendingForSessions(staleSessions);
        for (Long sessionDbId : staleSessions) {
            registry.remove(sessionDbId);
        }
        if (!staleSessions.isEmpty()) {
            log.warn("[Recovery] Failed {} stale session(s) and {} pending message(s)",
                    staleSessions.size(), failedMessages);
        }

        // 3. orphaned helpers
        int reaped = processRegistry.reapOrphans(registry.liveSessionIds());

        // 4. undrained queues
        int started = 0;
        int skipped = 0;
        boolean firstStart = true;
        for (Long sessionDbId : messageStore.sessionsWithPendingWork()) {
            if (started >= properties.maxSessionsPerPass()) {
                skipped++;
                continue;
            }
            SessionContext context;
            try {
                context = registry.initializeSession(sessionDbId);
            } catch (IllegalArgumentException e) {
                log.warn("[Recovery] Pending work for unknown session {}: {}", sessionDbId, e.getMessage());
                continue;
            }
            if (context.isConsumerRunning()) {
                skipped++;
                continue;
            }
            if (!firstStart && !pace()) {
                break;
            }
            if (processor.start(context, "recovery")) {
                started++;
                firstStart = false;
            }
        }

        statusService.broadcast();
        return new RecoveryResult(resetMessages, staleSessions.size(), failedMessages, reaped, started, skipped);
    }

    private boolean pace() {
        try {
            Thread.sleep(properties.startDelay().toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Recovery] Interrupted while pacing consumer starts");
            return false;
        }
    }
}
