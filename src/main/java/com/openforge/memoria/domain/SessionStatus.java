package com.openforge.memoria.domain;

import jakarta.persistence.AttributeConverter;

/**
 * Lifecycle of a persisted session row.
 *
 *   active ──(owner closes)──▶ completed
 *   active ──(stale, recovery)──▶ failed
 */
public enum SessionStatus {

    ACTIVE("active"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String dbValue;

    SessionStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    public String dbValue() {
        return dbValue;
    }

    public static SessionStatus fromDbValue(String value) {
        for (SessionStatus s : values()) {
            if (s.dbValue.equals(value)) return s;
        }
        throw new IllegalArgumentException("Unknown session status: " + value);
    }

    @jakarta.persistence.Converter
    public static class DbConverter implements AttributeConverter<SessionStatus, String> {

        @Override
        public String convertToDatabaseColumn(SessionStatus attribute) {
            return attribute == null ? null : attribute.dbValue();
        }

        @Override
        public SessionStatus convertToEntityAttribute(String dbData) {
            return dbData == null ? null : fromDbValue(dbData);
        }
    }
}
