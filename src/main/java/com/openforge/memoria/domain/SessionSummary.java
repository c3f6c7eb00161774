package com.openforge.memoria.domain;

import jakarta.persistence.*;
import lombok.*;

/** End-of-prompt digest of what was asked and what came of it. Never updated. */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "session_summaries",
    indexes = @Index(name = "idx_summaries_memory_session", columnList = "memory_session_id")
)
public class SessionSummary extends BaseEntity {

    @Column(name = "memory_session_id", nullable = false, length = 128)
    private String memorySessionId;

    @Column(name = "project", nullable = false, length = 256)
    private String project;

    @Column(name = "request", columnDefinition = "TEXT")
    private String request;

    @Column(name = "investigated", columnDefinition = "TEXT")
    private String investigated;

    @Column(name = "learned", columnDefinition = "TEXT")
    private String learned;

    @Column(name = "completed", columnDefinition = "TEXT")
    private String completed;

    @Column(name = "next_steps", columnDefinition = "TEXT")
    private String nextSteps;

    @Column(name = "notes", columnDefinition = "TEXT")
    private String notes;

    @Column(name = "prompt_number")
    private Integer promptNumber;

    @Builder.Default
    @Column(name = "discovery_tokens", nullable = false)
    private Integer discoveryTokens = 0;

    @Column(name = "created_at_epoch", nullable = false)
    private Long createdAtEpoch;
}
