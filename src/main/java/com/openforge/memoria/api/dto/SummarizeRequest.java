package com.openforge.memoria.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record SummarizeRequest(

        @NotBlank(message = "content_session_id must not be blank")
        String contentSessionId,

        String lastAssistantMessage,

        String cwd
) {}
