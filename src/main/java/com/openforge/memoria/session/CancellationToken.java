package com.openforge.memoria.session;

import com.openforge.memoria.agent.AgentCancelledException;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-shot cooperative cancellation signal for a single consumer run.
 *
 * A token is never reset: restarting a consumer always allocates a new one
 * (see {@link SessionContext#renewToken()}), so a late cancel aimed at the
 * previous run cannot stop the next.
 *
 * Callbacks registered with {@link #onCancel(Runnable)} run on the cancelling
 * thread; they are used to wake a waiting message sequence and to kill helper
 * processes that are mid-call.
 */
@Slf4j
public final class CancellationToken {

    private final AtomicBoolean            cancelled = new AtomicBoolean(false);
    private final List<Runnable>           callbacks = new CopyOnWriteArrayList<>();
    private volatile String                reason;

    /** @return true if this call flipped the token, false if it was already cancelled */
    public boolean cancel(String reason) {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        this.reason = reason;
        for (Runnable callback : callbacks) {
            try {
                callback.run();
            } catch (RuntimeException e) {
                log.warn("[Cancel] Callback failed while cancelling ({}): {}", reason, e.getMessage());
            }
        }
        return true;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public String reason() {
        return reason;
    }

    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new AgentCancelledException("Cancelled: " + reason);
        }
    }

    /**
     * Register a callback; runs immediately if the token is already cancelled.
     * The returned handle unregisters it.
     */
    public Registration onCancel(Runnable callback) {
        callbacks.add(callback);
        if (cancelled.get() && callbacks.remove(callback)) {
            callback.run();
        }
        return () -> callbacks.remove(callback);
    }

    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}
