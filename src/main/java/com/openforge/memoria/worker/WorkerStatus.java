package com.openforge.memoria.worker;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** Liveness snapshot reported by the admin API and the health indicator. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record WorkerStatus(
        boolean accepting,
        long uptimeMs,
        String provider,
        int liveSessions,
        int runningConsumers,
        long queueDepth,
        int helperProcesses
) {}
