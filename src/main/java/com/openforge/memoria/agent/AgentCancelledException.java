package com.openforge.memoria.agent;

/** Raised when the run's cancellation token fires. Not a failure; never retried. */
public class AgentCancelledException extends AgentException {

    public AgentCancelledException(String message) {
        super(message);
    }

    @Override
    public FailureKind kind() {
        return FailureKind.CANCELLED;
    }
}
