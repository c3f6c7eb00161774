package com.openforge.memoria.repository;

import com.openforge.memoria.domain.Observation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ObservationRepository extends JpaRepository<Observation, Long> {

    List<Observation> findByMemorySessionIdOrderByIdAsc(String memorySessionId);

    long countByMemorySessionId(String memorySessionId);
}
