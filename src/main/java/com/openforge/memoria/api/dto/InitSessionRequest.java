package com.openforge.memoria.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request body for POST /api/sessions/init.
 *
 * @param contentSessionId conversation id issued by the host tool
 * @param project          project name; "unknown" when blank
 * @param prompt           the user prompt that starts this turn
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record InitSessionRequest(

        @NotBlank(message = "content_session_id must not be blank")
        @Size(max = 128)
        String contentSessionId,

        String project,

        String prompt
) {}
