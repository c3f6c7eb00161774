package com.openforge.memoria.domain;

import jakarta.persistence.*;
import lombok.*;

/**
 * One coding conversation, tracked from its first tool use to completion.
 *
 * Two identities:
 *
 *  contentSessionId — issued by the editor/IDE hook, stable for the whole
 *                     conversation, unique across the table.
 *
 *  memorySessionId  — issued by the extraction side once the first extraction
 *                     call succeeds. Observations and summaries reference it,
 *                     so it must exist before any of them is inserted. Once
 *                     set it never changes (SdkSessionRepository only writes
 *                     it when the column is still NULL).
 *
 * promptCounter is bumped each time the user submits a new prompt in the
 * same conversation; it selects the init vs. continuation prompt shape.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "sdk_sessions",
    uniqueConstraints = @UniqueConstraint(name = "uq_content_session_id", columnNames = "content_session_id"),
    indexes = @Index(name = "idx_sdk_sessions_status", columnList = "status, started_at_epoch")
)
public class SdkSession extends BaseEntity {

    @Column(name = "content_session_id", nullable = false, length = 128)
    private String contentSessionId;

    @Column(name = "memory_session_id", length = 128)
    private String memorySessionId;

    @Column(name = "project", nullable = false, length = 256)
    private String project;

    @Column(name = "user_prompt", columnDefinition = "TEXT")
    private String userPrompt;

    @Builder.Default
    @Column(name = "prompt_counter", nullable = false)
    private Integer promptCounter = 0;

    @Builder.Default
    @Convert(converter = SessionStatus.DbConverter.class)
    @Column(name = "status", nullable = false, length = 16)
    private SessionStatus status = SessionStatus.ACTIVE;

    @Column(name = "started_at_epoch", nullable = false)
    private Long startedAtEpoch;

    @Column(name = "completed_at_epoch")
    private Long completedAtEpoch;
}
