package com.openforge.memoria.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.openforge.memoria.worker.SessionService;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SessionStatusResponse(
        Long sessionDbId,
        String contentSessionId,
        String memorySessionId,
        String status,
        int promptNumber,
        long queueDepth,
        String processorState,
        String provider
) {

    public static SessionStatusResponse from(SessionService.SessionStatusView view) {
        return new SessionStatusResponse(view.sessionDbId(), view.contentSessionId(), view.memorySessionId(),
                view.status(), view.promptNumber(), view.queueDepth(), view.processorState(), view.provider());
    }
}
