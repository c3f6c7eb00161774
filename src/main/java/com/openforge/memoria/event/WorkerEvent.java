package com.openforge.memoria.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * The envelope broadcast over WebSocket for one session.
 *
 *   sessionDbId — the session row the event belongs to
 *   type        — discriminator, see {@link EventType}
 *   content     — free-form text (abandon reason, provider name)
 *   payload     — structured detail for stored records, null otherwise
 *   timestamp   — epoch millis
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record WorkerEvent(
        Long      sessionDbId,
        EventType type,
        String    content,
        Object    payload,
        long      timestamp
) {

    public static WorkerEvent observationStored(Long sessionDbId, Long observationId, String title, long now) {
        return new WorkerEvent(sessionDbId, EventType.OBSERVATION_STORED, title,
                new StoredRecordPayload(observationId, title), now);
    }

    public static WorkerEvent summaryStored(Long sessionDbId, Long summaryId, long now) {
        return new WorkerEvent(sessionDbId, EventType.SUMMARY_STORED, null,
                new StoredRecordPayload(summaryId, null), now);
    }

    public static WorkerEvent sessionCompleted(Long sessionDbId, long now) {
        return new WorkerEvent(sessionDbId, EventType.SESSION_COMPLETED, null, null, now);
    }

    public static WorkerEvent sessionAbandoned(Long sessionDbId, String reason, int abandonedMessages, long now) {
        return new WorkerEvent(sessionDbId, EventType.SESSION_ABANDONED, reason,
                new AbandonedPayload(abandonedMessages), now);
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record StoredRecordPayload(Long id, String title) {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record AbandonedPayload(int abandonedMessages) {}
}
