package com.openforge.memoria.queue;

import com.openforge.memoria.domain.MessageKind;
import com.openforge.memoria.domain.MessageStatus;
import com.openforge.memoria.domain.PendingMessage;
import com.openforge.memoria.domain.SdkSession;
import com.openforge.memoria.repository.PendingMessageRepository;
import com.openforge.memoria.worker.WorkerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Durable per-session work queue on top of the pending_messages table.
 *
 * State transitions are all single guarded UPDATEs (see
 * {@link PendingMessageRepository}), so they are atomic with respect to each
 * other without row locks:
 *
 *   claimNext           pending    → processing
 *   complete            processing → processed    (idempotent)
 *   fail                processing → pending | failed
 *   resetStaleProcessing processing → pending     (crash recovery)
 *   markAllAbandoned    pending|processing → failed
 *
 * Within one session only the owning processor claims, so the store does not
 * need to arbitrate same-session claimers; a lost guard simply means someone
 * else (the recovery pass) moved the row first.
 */
@Slf4j
@Service
public class PendingMessageStore {

    private static final Set<MessageStatus> QUEUED =
            EnumSet.of(MessageStatus.PENDING, MessageStatus.PROCESSING);

    private static final int CLAIM_ATTEMPTS = 5;

    private final PendingMessageRepository repository;
    private final Clock clock;
    private final int maxRetries;

    public PendingMessageStore(PendingMessageRepository repository,
                               Clock clock,
                               WorkerProperties workerProperties) {
        this.repository = repository;
        this.clock      = clock;
        this.maxRetries = workerProperties.maxRetries();
    }

    // ── Producer side ────────────────────────────────────────────────────────

    @Transactional
    public Long enqueue(SdkSession session, MessageKind kind, MessagePayload payload) {
        PendingMessage message = PendingMessage.builder()
                .sessionDbId(session.getId())
                .contentSessionId(session.getContentSessionId())
                .kind(kind)
                .toolName(payload.toolName())
                .toolInput(payload.toolInput())
                .toolResponse(payload.toolResponse())
                .lastAssistantMessage(payload.lastAssistantMessage())
                .cwd(payload.cwd())
                .promptNumber(payload.promptNumber())
                .status(MessageStatus.PENDING)
                .retryCount(0)
                .createdAtEpoch(clock.millis())
                .build();
        Long id = repository.save(message).getId();
        log.debug("[Queue] Enqueued {} id={} sessionDbId={}", kind.dbValue(), id, session.getId());
        return id;
    }

    // ── Consumer side ────────────────────────────────────────────────────────

    /**
     * Claim the oldest pending message of a session.
     *
     * If the guarded update loses (the row was abandoned or failed by the
     * recovery pass between the read and the write), the next oldest is tried.
     */
    public Optional<PendingMessage> claimNext(Long sessionDbId) {
        for (int attempt = 0; attempt < CLAIM_ATTEMPTS; attempt++) {
            Optional<PendingMessage> oldest =
                    repository.findFirstBySessionDbIdAndStatusOrderByIdAsc(sessionDbId, MessageStatus.PENDING);
            if (oldest.isEmpty()) {
                return Optional.empty();
            }
            Long id = oldest.get().getId();
            int updated = repository.claim(id, MessageStatus.PENDING, MessageStatus.PROCESSING, clock.millis());
            if (updated == 1) {
                return repository.findById(id);
            }
            log.debug("[Queue] Lost claim race on message {} (session {}), retrying", id, sessionDbId);
        }
        return Optional.empty();
    }

    /**
     * Mark processed and drop the payload. Completing twice is a no-op, and so
     * is completing a message the recovery pass already failed. A message the
     * periodic pass demoted to pending while its call was still running is
     * completed normally.
     */
    public void complete(Long messageId) {
        int updated = repository.complete(messageId, QUEUED, MessageStatus.PROCESSED, clock.millis());
        if (updated == 0) {
            log.debug("[Queue] complete({}) was a no-op (already processed, failed or missing)", messageId);
        }
    }

    /**
     * Record a failed attempt. retry_count always grows by one; the message
     * goes back to pending while the count stays within {@code maxRetries},
     * otherwise it ends in failed and is left for inspection.
     */
    @Transactional
    public FailOutcome fail(Long messageId) {
        long now = clock.millis();
        if (repository.failAndRequeue(messageId, MessageStatus.PENDING, MessageStatus.PROCESSING,
                maxRetries, now) == 1) {
            return FailOutcome.REQUEUED;
        }
        if (repository.failTerminally(messageId, MessageStatus.FAILED, MessageStatus.PROCESSING,
                maxRetries, now) == 1) {
            log.warn("[Queue] Message {} exhausted its retry budget ({}), marked failed", messageId, maxRetries);
            return FailOutcome.EXHAUSTED;
        }
        return FailOutcome.NOT_PROCESSING;
    }

    // ── Recovery side ────────────────────────────────────────────────────────

    /**
     * Demote claims older than {@code olderThanMs} back to pending.
     * 0 reclaims every processing row (cold start after an unclean shutdown).
     */
    public int resetStaleProcessing(long olderThanMs) {
        long before = olderThanMs <= 0 ? Long.MAX_VALUE : clock.millis() - olderThanMs;
        return repository.resetProcessingStartedBefore(MessageStatus.PENDING, MessageStatus.PROCESSING, before);
    }

    /** Pending plus in-flight messages of one session. */
    public long pendingCount(Long sessionDbId) {
        return repository.countBySessionDbIdAndStatusIn(sessionDbId, QUEUED);
    }

    /** Pending plus in-flight messages across all sessions. */
    public long totalQueueDepth() {
        return repository.countByStatusIn(QUEUED);
    }

    public List<Long> sessionsWithPendingWork() {
        return repository.findSessionIdsWithStatus(MessageStatus.PENDING);
    }

    /** Terminal failure for everything still queued for a session being retired. */
    public int markAllAbandoned(Long sessionDbId) {
        return repository.failAllForSessions(List.of(sessionDbId), QUEUED, MessageStatus.FAILED, clock.millis());
    }

    /** Used by stale-session cleanup: only pending rows are failed, in-flight ones are left alone. */
    public int failPendingForSessions(Collection<Long> sessionDbIds) {
        if (sessionDbIds.isEmpty()) return 0;
        return repository.failAllForSessions(sessionDbIds, EnumSet.of(MessageStatus.PENDING),
                MessageStatus.FAILED, clock.millis());
    }
}
