package com.openforge.memoria.agent;

/**
 * How the processor reacts to an agent failure.
 */
public enum FailureKind {

    /** Static misconfiguration (missing executable, bad key). Never retried. */
    FATAL,

    /** The provider-side conversation is gone. Triggers the fallback chain. */
    SESSION_TERMINATED,

    /** Cooperative cancellation. Propagated, never retried. */
    CANCELLED,

    /** Network or process hiccup. The processor may restart with a fresh token. */
    TRANSIENT
}
