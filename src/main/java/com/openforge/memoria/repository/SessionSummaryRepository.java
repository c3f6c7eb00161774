package com.openforge.memoria.repository;

import com.openforge.memoria.domain.SessionSummary;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SessionSummaryRepository extends JpaRepository<SessionSummary, Long> {

    List<SessionSummary> findByMemorySessionIdOrderByIdAsc(String memorySessionId);
}
