package com.openforge.memoria.session;

import com.openforge.memoria.domain.SdkSession;
import com.openforge.memoria.domain.SessionStatus;
import com.openforge.memoria.repository.SdkSessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Persisted session rows: creation on first sight, prompt counting, the
 * write-once memory-session id and status transitions.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionStore {

    private final SdkSessionRepository repository;
    private final Clock                clock;

    public Optional<SdkSession> findById(Long sessionDbId) {
        return repository.findById(sessionDbId);
    }

    public Optional<SdkSession> findByContentSessionId(String contentSessionId) {
        return repository.findByContentSessionId(contentSessionId);
    }

    /**
     * Return the row for a content-session id, inserting it if this is the
     * first time the id is seen. A concurrent insert of the same id loses on
     * the unique constraint and re-reads the winner's row.
     */
    public SdkSession findOrCreate(String contentSessionId, String project, String userPrompt) {
        Optional<SdkSession> existing = repository.findByContentSessionId(contentSessionId);
        if (existing.isPresent()) {
            return existing.get();
        }
        SdkSession fresh = SdkSession.builder()
                .contentSessionId(contentSessionId)
                .project(project == null || project.isBlank() ? "unknown" : project)
                .userPrompt(userPrompt)
                .promptCounter(0)
                .status(SessionStatus.ACTIVE)
                .startedAtEpoch(clock.millis())
                .build();
        try {
            SdkSession saved = repository.saveAndFlush(fresh);
            log.info("[Sessions] Created session {} for content session {} project={}",
                    saved.getId(), contentSessionId, saved.getProject());
            return saved;
        } catch (DataIntegrityViolationException e) {
            return repository.findByContentSessionId(contentSessionId)
                    .orElseThrow(() -> e);
        }
    }

    /** A new user prompt in the conversation: bump the counter and return the fresh row. */
    public SdkSession registerPrompt(String contentSessionId, String project, String prompt) {
        SdkSession session = findOrCreate(contentSessionId, project, prompt);
        repository.incrementPromptCounter(session.getId(), prompt);
        return repository.findById(session.getId())
                .orElseThrow(() -> new IllegalStateException("Session vanished: " + session.getId()));
    }

    /**
     * Persist a memory-session id unless one is already stored, and return the
     * id that is actually in effect. Callers must use the returned value, which
     * may differ from {@code candidate} when another agent got there first.
     */
    public String assignMemorySessionId(Long sessionDbId, String candidate) {
        int updated = repository.assignMemorySessionId(sessionDbId, candidate);
        if (updated == 1) {
            log.info("[Sessions] MEMORY_ID_ASSIGNED sessionDbId={} memorySessionId={}", sessionDbId, candidate);
            return candidate;
        }
        return repository.findById(sessionDbId)
                .map(SdkSession::getMemorySessionId)
                .orElseThrow(() -> new IllegalStateException("Session vanished: " + sessionDbId));
    }

    public boolean markCompleted(Long sessionDbId) {
        return repository.transitionStatus(List.of(sessionDbId),
                SessionStatus.ACTIVE, SessionStatus.COMPLETED, clock.millis()) == 1;
    }

    /**
     * Force active sessions that started more than {@code threshold} ago into
     * failed. Sessions in {@code exclude} (those with a live consumer) are
     * left alone. Returns the ids that were failed.
     */
    public List<Long> failStaleSessions(Duration threshold, Set<Long> exclude) {
        long before = clock.millis() - threshold.toMillis();
        List<Long> stale = repository.findIdsByStatusStartedBefore(SessionStatus.ACTIVE, before).stream()
                .filter(id -> !exclude.contains(id))
                .toList();
        if (stale.isEmpty()) {
            return stale;
        }
        repository.transitionStatus(stale, SessionStatus.ACTIVE, SessionStatus.FAILED, clock.millis());
        return stale;
    }
}
