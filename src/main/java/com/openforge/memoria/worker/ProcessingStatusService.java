package com.openforge.memoria.worker;

import com.openforge.memoria.event.ProcessingStatusEvent;
import com.openforge.memoria.event.WorkerEventPublisher;
import com.openforge.memoria.queue.PendingMessageStore;
import com.openforge.memoria.session.SessionRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Computes and broadcasts the aggregate {is_processing, queue_depth} status.
 * Also fired on every registry removal.
 */
@Slf4j
@Service
public class ProcessingStatusService {

    private final SessionRegistry      registry;
    private final PendingMessageStore  messageStore;
    private final WorkerEventPublisher publisher;

    public ProcessingStatusService(SessionRegistry registry,
                                   PendingMessageStore messageStore,
                                   WorkerEventPublisher publisher) {
        this.registry     = registry;
        this.messageStore = messageStore;
        this.publisher    = publisher;
        registry.addRemovalListener(sessionDbId -> broadcast());
    }

    public ProcessingStatusEvent current() {
        long queueDepth = messageStore.totalQueueDepth();
        boolean processing = registry.isAnySessionProcessing() || queueDepth > 0;
        return new ProcessingStatusEvent(processing, queueDepth);
    }

    public void broadcast() {
        ProcessingStatusEvent status;
        try {
            status = current();
        } catch (RuntimeException e) {
            log.warn("[Status] Could not compute processing status: {}", e.getMessage());
            return;
        }
        log.debug("[Status] isProcessing={} queueDepth={}", status.isProcessing(), status.queueDepth());
        publisher.publishStatus(status);
    }
}
