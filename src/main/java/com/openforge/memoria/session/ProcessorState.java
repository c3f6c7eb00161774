package com.openforge.memoria.session;

/**
 * Consumer state of one session.
 *
 *   IDLE ──start──▶ RUNNING ──▶ COMPLETED | FAILED | CANCELLED
 *
 * A terminal state returns to RUNNING only through a restart with a fresh
 * cancellation token; FAILED (fatal) and CANCELLED never restart on their own.
 */
public enum ProcessorState {
    IDLE,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED
}
