package com.openforge.memoria.repository;

import com.openforge.memoria.domain.MessageStatus;
import com.openforge.memoria.domain.PendingMessage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Every mutation here is a single status-guarded UPDATE. The guard in the
 * WHERE clause is what makes a claim atomic against the recovery pass: if a
 * reclaim or abandonment got there first, the update touches zero rows.
 */
@Repository
public interface PendingMessageRepository extends JpaRepository<PendingMessage, Long> {

    /** Oldest row of a session in the given status; FIFO is insertion order (id). */
    Optional<PendingMessage> findFirstBySessionDbIdAndStatusOrderByIdAsc(Long sessionDbId, MessageStatus status);

    long countBySessionDbIdAndStatusIn(Long sessionDbId, Collection<MessageStatus> statuses);

    long countByStatusIn(Collection<MessageStatus> statuses);

    @Query("""
            select distinct m.sessionDbId from PendingMessage m
            where m.status = :status
            order by m.sessionDbId asc
            """)
    List<Long> findSessionIdsWithStatus(@Param("status") MessageStatus status);

    List<PendingMessage> findBySessionDbIdOrderByIdAsc(Long sessionDbId);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("""
            update PendingMessage m set m.status = :to, m.startedProcessingAtEpoch = :now
            where m.id = :id and m.status = :from
            """)
    int claim(@Param("id") Long id,
              @Param("from") MessageStatus from,
              @Param("to") MessageStatus to,
              @Param("now") long now);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("""
            update PendingMessage m set m.status = :processed, m.completedAtEpoch = :now,
                   m.toolInput = null, m.toolResponse = null, m.lastAssistantMessage = null
            where m.id = :id and m.status in :from
            """)
    int complete(@Param("id") Long id,
                 @Param("from") Collection<MessageStatus> from,
                 @Param("processed") MessageStatus processed,
                 @Param("now") long now);

    /** Failure with retry budget left: back to the queue, retry_count + 1. */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("""
            update PendingMessage m set m.status = :pending, m.retryCount = m.retryCount + 1,
                   m.startedProcessingAtEpoch = null, m.failedAtEpoch = :now
            where m.id = :id and m.status = :processing and m.retryCount < :maxRetries
            """)
    int failAndRequeue(@Param("id") Long id,
                       @Param("pending") MessageStatus pending,
                       @Param("processing") MessageStatus processing,
                       @Param("maxRetries") int maxRetries,
                       @Param("now") long now);

    /** Failure with the retry budget spent: terminal. */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("""
            update PendingMessage m set m.status = :failed, m.retryCount = m.retryCount + 1,
                   m.failedAtEpoch = :now
            where m.id = :id and m.status = :processing and m.retryCount >= :maxRetries
            """)
    int failTerminally(@Param("id") Long id,
                       @Param("failed") MessageStatus failed,
                       @Param("processing") MessageStatus processing,
                       @Param("maxRetries") int maxRetries,
                       @Param("now") long now);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("""
            update PendingMessage m set m.status = :pending, m.startedProcessingAtEpoch = null
            where m.status = :processing and m.startedProcessingAtEpoch < :before
            """)
    int resetProcessingStartedBefore(@Param("pending") MessageStatus pending,
                                     @Param("processing") MessageStatus processing,
                                     @Param("before") long before);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("""
            update PendingMessage m set m.status = :failed, m.failedAtEpoch = :now
            where m.sessionDbId in :sessionIds and m.status in :from
            """)
    int failAllForSessions(@Param("sessionIds") Collection<Long> sessionIds,
                           @Param("from") Collection<MessageStatus> from,
                           @Param("failed") MessageStatus failed,
                           @Param("now") long now);
}
