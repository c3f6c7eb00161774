package com.openforge.memoria.domain;

import jakarta.persistence.*;
import lombok.*;

/**
 * One durable unit of queued work for a session.
 *
 * Rows are inserted by the ingestion layer and afterwards mutated only
 * through the bulk, status-guarded updates in PendingMessageRepository —
 * never by saving a loaded entity — so a claim can never be overwritten by a
 * concurrent reclaim.
 *
 * Payload columns (tool_input, tool_response, last_assistant_message) are
 * nulled on completion to keep the table small.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "pending_messages",
    indexes = {
        @Index(name = "idx_pending_session_status", columnList = "session_db_id, status"),
        @Index(name = "idx_pending_status_started", columnList = "status, started_processing_at_epoch")
    }
)
public class PendingMessage extends BaseEntity {

    @Column(name = "session_db_id", nullable = false)
    private Long sessionDbId;

    @Column(name = "content_session_id", nullable = false, length = 128)
    private String contentSessionId;

    @Convert(converter = MessageKind.DbConverter.class)
    @Column(name = "message_type", nullable = false, length = 16)
    private MessageKind kind;

    @Column(name = "tool_name", length = 128)
    private String toolName;

    @Column(name = "tool_input", columnDefinition = "TEXT")
    private String toolInput;

    @Column(name = "tool_response", columnDefinition = "TEXT")
    private String toolResponse;

    @Column(name = "last_assistant_message", columnDefinition = "TEXT")
    private String lastAssistantMessage;

    @Column(name = "cwd", length = 1024)
    private String cwd;

    @Column(name = "prompt_number")
    private Integer promptNumber;

    @Builder.Default
    @Convert(converter = MessageStatus.DbConverter.class)
    @Column(name = "status", nullable = false, length = 16)
    private MessageStatus status = MessageStatus.PENDING;

    @Builder.Default
    @Column(name = "retry_count", nullable = false)
    private Integer retryCount = 0;

    @Column(name = "created_at_epoch", nullable = false)
    private Long createdAtEpoch;

    @Column(name = "started_processing_at_epoch")
    private Long startedProcessingAtEpoch;

    @Column(name = "completed_at_epoch")
    private Long completedAtEpoch;

    @Column(name = "failed_at_epoch")
    private Long failedAtEpoch;
}
