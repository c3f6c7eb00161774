package com.openforge.memoria.domain;

import jakarta.persistence.AttributeConverter;

/** What a queued message asks the extraction agent to produce. */
public enum MessageKind {

    /** One tool use; yields zero or more observations. */
    OBSERVATION("observation"),

    /** End of a prompt cycle; yields a session summary. */
    SUMMARIZE("summarize");

    private final String dbValue;

    MessageKind(String dbValue) {
        this.dbValue = dbValue;
    }

    public String dbValue() {
        return dbValue;
    }

    public static MessageKind fromDbValue(String value) {
        for (MessageKind k : values()) {
            if (k.dbValue.equals(value)) return k;
        }
        throw new IllegalArgumentException("Unknown message kind: " + value);
    }

    @jakarta.persistence.Converter
    public static class DbConverter implements AttributeConverter<MessageKind, String> {

        @Override
        public String convertToDatabaseColumn(MessageKind attribute) {
            return attribute == null ? null : attribute.dbValue();
        }

        @Override
        public MessageKind convertToEntityAttribute(String dbData) {
            return dbData == null ? null : fromDbValue(dbData);
        }
    }
}
