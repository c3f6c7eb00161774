package com.openforge.memoria.websocket;

import com.openforge.memoria.event.ProcessingStatusEvent;
import com.openforge.memoria.event.WorkerEvent;
import com.openforge.memoria.event.WorkerEventPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Routes worker events to STOMP topics.
 *
 * Topic layout:
 *   /topic/processing-status     → aggregate {is_processing, queue_depth}
 *   /topic/sessions/{sessionDbId} → per-session events
 *
 * SimpMessagingTemplate is thread-safe; consumer threads publish concurrently.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StompWorkerEventPublisher implements WorkerEventPublisher {

    static final String STATUS_TOPIC   = "/topic/processing-status";
    static final String SESSION_PREFIX = "/topic/sessions/";

    private final SimpMessagingTemplate messagingTemplate;

    @Override
    public void publishStatus(ProcessingStatusEvent event) {
        send(STATUS_TOPIC, event, "processing-status");
    }

    @Override
    public void publish(WorkerEvent event) {
        send(SESSION_PREFIX + event.sessionDbId(), event, event.type().wireValue());
    }

    private void send(String destination, Object event, String label) {
        try {
            messagingTemplate.convertAndSend(destination, event);
        } catch (Exception e) {
            // delivery failures must not break a consumer
            log.warn("[Publisher] Failed to deliver {} event to {}: {}", label, destination, e.getMessage());
        }
    }
}
