package com.openforge.memoria.repository;

import com.openforge.memoria.domain.SdkSession;
import com.openforge.memoria.domain.SessionStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface SdkSessionRepository extends JpaRepository<SdkSession, Long> {

    Optional<SdkSession> findByContentSessionId(String contentSessionId);

    @Query("select s.id from SdkSession s where s.status = :status and s.startedAtEpoch < :before")
    List<Long> findIdsByStatusStartedBefore(@Param("status") SessionStatus status,
                                            @Param("before") long before);

    /** Write-once: only succeeds while the column is still NULL. */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("update SdkSession s set s.memorySessionId = :memoryId where s.id = :id and s.memorySessionId is null")
    int assignMemorySessionId(@Param("id") Long id, @Param("memoryId") String memoryId);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("""
            update SdkSession s set s.promptCounter = s.promptCounter + 1, s.userPrompt = :prompt
            where s.id = :id
            """)
    int incrementPromptCounter(@Param("id") Long id, @Param("prompt") String prompt);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("""
            update SdkSession s set s.status = :to, s.completedAtEpoch = :now
            where s.id in :ids and s.status = :from
            """)
    int transitionStatus(@Param("ids") Collection<Long> ids,
                         @Param("from") SessionStatus from,
                         @Param("to") SessionStatus to,
                         @Param("now") long now);
}
