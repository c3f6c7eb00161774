package com.openforge.memoria.event;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Classifies every per-session event broadcast on /topic/sessions/{id}.
 */
public enum EventType {

    /** An observation row was written. payload = observation id + title. */
    OBSERVATION_STORED,

    /** A summary row was written. payload = summary id. */
    SUMMARY_STORED,

    /** The owner closed the session. */
    SESSION_COMPLETED,

    /** Every agent in the fallback chain failed; queued work was marked failed. content = reason. */
    SESSION_ABANDONED;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
