package com.openforge.memoria.agent;

public class SessionTerminatedException extends AgentException {

    public SessionTerminatedException(String message) {
        super(message);
    }

    public SessionTerminatedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind kind() {
        return FailureKind.SESSION_TERMINATED;
    }
}
