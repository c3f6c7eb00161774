package com.openforge.memoria.worker;

import com.openforge.memoria.agent.AgentSelector;
import com.openforge.memoria.process.ProcessRegistry;
import com.openforge.memoria.queue.PendingMessageStore;
import com.openforge.memoria.session.SessionRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * start / stop / restart / status of the processing layer.
 *
 *   start   — reclaim every in-flight message, accept work, run the rest of
 *             the recovery pass
 *   stop    — stop accepting, let in-flight messages finish within the
 *             shutdown timeout, then cancel every consumer and kill helpers
 *   restart — stop then start inside the running JVM
 *
 * Runs in the last lifecycle phase, so consumers start after the web layer
 * and stop before it.
 */
@Slf4j
@Component
public class WorkerLifecycle implements SmartLifecycle {

    private final SessionProcessor    processor;
    private final RecoveryCoordinator recovery;
    private final SessionRegistry     registry;
    private final PendingMessageStore messageStore;
    private final ProcessRegistry     processRegistry;
    private final ProcessingStatusService statusService;
    private final AgentSelector       selector;
    private final WorkerProperties    properties;
    private final Clock               clock;

    private volatile boolean running;
    private volatile long    startedAt;

    public WorkerLifecycle(SessionProcessor processor,
                           RecoveryCoordinator recovery,
                           SessionRegistry registry,
                           PendingMessageStore messageStore,
                           ProcessRegistry processRegistry,
                           ProcessingStatusService statusService,
                           AgentSelector selector,
                           WorkerProperties properties,
                           Clock clock) {
        this.processor       = processor;
        this.recovery        = recovery;
        this.registry        = registry;
        this.messageStore    = messageStore;
        this.processRegistry = processRegistry;
        this.statusService   = statusService;
        this.selector        = selector;
        this.properties      = properties;
        this.clock           = clock;
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        int reset = recovery.resetAllInFlight();
        processor.setAccepting(true);
        startedAt = clock.millis();
        running = true;
        log.info("[Worker] Accepting work provider={}", selector.configuredProvider());
        recovery.runStartupPass(reset);
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        processor.setAccepting(false);
        log.info("[Worker] Stopping, waiting up to {} for in-flight messages", properties.shutdownTimeout());
        try {
            if (!processor.awaitInFlight(properties.shutdownTimeout())) {
                log.warn("[Worker] Shutdown timeout reached with messages still in flight, forcing stop");
            }
            processor.cancelAll("worker stopping");
            int killed = processRegistry.killAll();
            if (!processor.awaitConsumers(properties.pollInterval().multipliedBy(5))) {
                log.warn("[Worker] Some consumers did not stop in time");
            }
            log.info("[Worker] Stopped, killed {} helper process(es)", killed);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            processor.cancelAll("worker stop interrupted");
            processRegistry.killAll();
        } finally {
            running = false;
            statusService.broadcast();
        }
    }

    public synchronized void restart() {
        log.info("[Worker] Restart requested");
        stop();
        start();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    public WorkerStatus status() {
        return new WorkerStatus(
                processor.isAccepting(),
                running ? clock.millis() - startedAt : 0,
                selector.configuredProvider(),
                registry.activeSessionCount(),
                registry.sessionsWithRunningConsumer().size(),
                messageStore.totalQueueDepth(),
                processRegistry.size());
    }
}
