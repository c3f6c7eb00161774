package com.openforge.memoria.queue;

/** Result of {@link PendingMessageStore#fail(Long)}. */
public enum FailOutcome {

    /** Retry budget left: the message is pending again with retry_count + 1. */
    REQUEUED,

    /** Retry budget spent: the message is failed and stays for inspection. */
    EXHAUSTED,

    /** The message was not in processing (already completed, reclaimed or abandoned). */
    NOT_PROCESSING
}
