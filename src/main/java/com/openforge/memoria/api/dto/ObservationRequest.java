package com.openforge.memoria.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;

/**
 * Request body for POST /api/sessions/observations. tool_input and
 * tool_response are arbitrary JSON.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ObservationRequest(

        @NotBlank(message = "content_session_id must not be blank")
        String contentSessionId,

        @NotBlank(message = "tool_name must not be blank")
        String toolName,

        JsonNode toolInput,

        JsonNode toolResponse,

        String cwd
) {}
