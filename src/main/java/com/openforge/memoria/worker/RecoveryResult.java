package com.openforge.memoria.worker;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * What one recovery pass did.
 *
 * @param resetMessages   processing → pending reclaims
 * @param failedSessions  stale sessions forced to failed
 * @param failedMessages  pending messages of those sessions forced to failed
 * @param reapedProcesses orphaned helper processes killed
 * @param startedSessions consumers started for undrained queues
 * @param skippedSessions undrained sessions left for the next pass (already running or over the cap)
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RecoveryResult(
        int resetMessages,
        int failedSessions,
        int failedMessages,
        int reapedProcesses,
        int startedSessions,
        int skippedSessions
) {}
