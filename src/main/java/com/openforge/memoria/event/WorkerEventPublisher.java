package com.openforge.memoria.event;

/**
 * Fire-and-forget sink for worker events. Implementations must never throw
 * into the caller.
 */
public interface WorkerEventPublisher {

    void publishStatus(ProcessingStatusEvent event);

    void publish(WorkerEvent event);
}
