package com.openforge.memoria.agent;

public class FatalAgentException extends AgentException {

    public FatalAgentException(String message) {
        super(message);
    }

    public FatalAgentException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind kind() {
        return FailureKind.FATAL;
    }
}
