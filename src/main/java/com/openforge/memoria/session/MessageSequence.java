package com.openforge.memoria.session;

import com.openforge.memoria.domain.PendingMessage;
import com.openforge.memoria.queue.PendingMessageStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * FIFO stream of a session's queued messages, claimed one at a time.
 *
 * {@link #hasNext()} blocks while the queue is empty, waking on
 * {@link SessionContext#signalWork()} or every poll interval. It returns
 * false when the run's token is cancelled (observed within one poll
 * interval) or when the queue stayed empty for the whole idle timeout, which
 * lets the agent's consume loop return normally.
 *
 * Every claimed id is appended to the context's processingMessageIds; the
 * agent clears them once the message is completed.
 */
@Slf4j
public class MessageSequence implements Iterable<PendingMessage>, Iterator<PendingMessage> {

    private final SessionContext      context;
    private final CancellationToken   token;
    private final PendingMessageStore store;
    private final Clock               clock;
    private final Duration            pollInterval;
    private final Duration            idleTimeout;

    private PendingMessage next;
    private boolean        finished;

    public MessageSequence(SessionContext context,
                           CancellationToken token,
                           PendingMessageStore store,
                           Clock clock,
                           Duration pollInterval,
                           Duration idleTimeout) {
        this.context      = context;
        this.token        = token;
        this.store        = store;
        this.clock        = clock;
        this.pollInterval = pollInterval;
        this.idleTimeout  = idleTimeout;
    }

    @Override
    public Iterator<PendingMessage> iterator() {
        return this;
    }

    @Override
    public boolean hasNext() {
        if (next != null) return true;
        if (finished) return false;

        long idleSince = clock.millis();
        while (true) {
            if (token.isCancelled()) {
                finished = true;
                return false;
            }

            Optional<PendingMessage> claimed = store.claimNext(context.getSessionDbId());
            if (claimed.isPresent()) {
                next = claimed.get();
                context.getProcessingMessageIds().add(next.getId());
                context.setEarliestPendingTimestamp(next.getCreatedAtEpoch());
                return true;
            }

            if (clock.millis() - idleSince >= idleTimeout.toMillis()) {
                log.debug("[Queue:{}] Idle for {}, ending message sequence",
                        context.getSessionDbId(), idleTimeout);
                finished = true;
                return false;
            }

            try {
                context.awaitWork(pollInterval);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                token.cancel("consumer thread interrupted");
                finished = true;
                return false;
            }
        }
    }

    @Override
    public PendingMessage next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Message sequence exhausted for session " + context.getSessionDbId());
        }
        PendingMessage message = next;
        next = null;
        return message;
    }
}
