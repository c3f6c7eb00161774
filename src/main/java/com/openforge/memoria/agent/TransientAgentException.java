package com.openforge.memoria.agent;

public class TransientAgentException extends AgentException {

    public TransientAgentException(String message) {
        super(message);
    }

    public TransientAgentException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind kind() {
        return FailureKind.TRANSIENT;
    }
}
