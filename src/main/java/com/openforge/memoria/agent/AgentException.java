package com.openforge.memoria.agent;

/**
 * Base of every failure an {@link ExtractionAgent} reports to its processor.
 * Subclasses fix the {@link FailureKind}; use {@link ErrorClassifier} to map
 * foreign throwables onto them.
 */
public abstract class AgentException extends RuntimeException {

    protected AgentException(String message) {
        super(message);
    }

    protected AgentException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract FailureKind kind();
}
