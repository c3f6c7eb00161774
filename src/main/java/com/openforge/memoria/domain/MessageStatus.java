package com.openforge.memoria.domain;

import jakarta.persistence.AttributeConverter;

/**
 * State of one queued unit of work.
 *
 *   pending ──claim──▶ processing ──complete──▶ processed
 *                          │
 *                          ├──fail (retry budget left)──▶ pending
 *                          ├──fail (budget spent)───────▶ failed
 *                          └──resetStaleProcessing──────▶ pending
 *
 * The stored values are lower-case so rows written by earlier versions of
 * the worker stay readable.
 */
public enum MessageStatus {

    PENDING("pending"),
    PROCESSING("processing"),
    PROCESSED("processed"),
    FAILED("failed");

    private final String dbValue;

    MessageStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    public String dbValue() {
        return dbValue;
    }

    public static MessageStatus fromDbValue(String value) {
        for (MessageStatus s : values()) {
            if (s.dbValue.equals(value)) return s;
        }
        throw new IllegalArgumentException("Unknown message status: " + value);
    }

    @jakarta.persistence.Converter
    public static class DbConverter implements AttributeConverter<MessageStatus, String> {

        @Override
        public String convertToDatabaseColumn(MessageStatus attribute) {
            return attribute == null ? null : attribute.dbValue();
        }

        @Override
        public MessageStatus convertToEntityAttribute(String dbData) {
            return dbData == null ? null : fromDbValue(dbData);
        }
    }
}
