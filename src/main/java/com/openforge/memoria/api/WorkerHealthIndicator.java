package com.openforge.memoria.api;

import com.openforge.memoria.worker.WorkerLifecycle;
import com.openforge.memoria.worker.WorkerStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/** Exposed as the "worker" component of /actuator/health. */
@Component("worker")
@RequiredArgsConstructor
public class WorkerHealthIndicator implements HealthIndicator {

    private final WorkerLifecycle lifecycle;

    @Override
    public Health health() {
        WorkerStatus status = lifecycle.status();
        Health.Builder builder = status.accepting() ? Health.up() : Health.outOfService();
        return builder
                .withDetail("uptimeMs", status.uptimeMs())
                .withDetail("provider", status.provider())
                .withDetail("liveSessions", status.liveSessions())
                .withDetail("runningConsumers", status.runningConsumers())
                .withDetail("queueDepth", status.queueDepth())
                .withDetail("helperProcesses", status.helperProcesses())
                .build();
    }
}
