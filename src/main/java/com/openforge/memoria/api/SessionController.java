package com.openforge.memoria.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.memoria.api.dto.CompleteSessionRequest;
import com.openforge.memoria.api.dto.InitSessionRequest;
import com.openforge.memoria.api.dto.InitSessionResponse;
import com.openforge.memoria.api.dto.ObservationRequest;
import com.openforge.memoria.api.dto.QueueResponse;
import com.openforge.memoria.api.dto.SessionStatusResponse;
import com.openforge.memoria.api.dto.SummarizeRequest;
import com.openforge.memoria.worker.SessionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

/**
 * Ingestion API used by the host tool's hooks.
 *
 * Endpoints:
 *   POST /api/sessions/init                       — register a user prompt
 *   POST /api/sessions/observations               — queue a tool execution
 *   POST /api/sessions/summarize                  — queue an end-of-turn summary
 *   POST /api/sessions/complete                   — owner closes the session
 *   GET  /api/sessions/{contentSessionId}/status  — persisted status and queue depth
 *
 * While the worker is stopping every write answers 503.
 */
@Slf4j
@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
public class SessionController {

    private final SessionService sessionService;
    private final ObjectMapper   objectMapper;

    @PostMapping("/init")
    public InitSessionResponse init(@Valid @RequestBody InitSessionRequest request) {
        SessionService.InitResult result =
                sessionService.init(request.contentSessionId(), request.project(), request.prompt());
        return new InitSessionResponse(result.sessionDbId(), result.promptNumber());
    }

    @PostMapping("/observations")
    public ResponseEntity<QueueResponse> observation(@Valid @RequestBody ObservationRequest request) {
        SessionService.QueueResult result = sessionService.queueObservation(
                request.contentSessionId(),
                request.toolName(),
                toJson(request.toolInput()),
                toJson(request.toolResponse()),
                request.cwd());
        return accepted(result);
    }

    @PostMapping("/summarize")
    public ResponseEntity<QueueResponse> summarize(@Valid @RequestBody SummarizeRequest request) {
        SessionService.QueueResult result = sessionService.queueSummarize(
                request.contentSessionId(), request.lastAssistantMessage(), request.cwd());
        return accepted(result);
    }

    @PostMapping("/complete")
    public ResponseEntity<Void> complete(@Valid @RequestBody CompleteSessionRequest request) {
        if (!sessionService.complete(request.contentSessionId())) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND,
                    "Session not found: " + request.contentSessionId());
        }
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{contentSessionId}/status")
    public SessionStatusResponse status(@PathVariable String contentSessionId) {
        return sessionService.status(contentSessionId)
                .map(SessionStatusResponse::from)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Session not found: " + contentSessionId));
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private static ResponseEntity<QueueResponse> accepted(SessionService.QueueResult result) {
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(new QueueResponse(result.status(), result.messageId()));
    }

    /** Strings are stored as-is, anything else as its JSON text. */
    private String toJson(JsonNode node) {
        if (node == null || node.isNull()) return null;
        if (node.isTextual()) return node.asText();
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unserializable tool payload", e);
        }
    }
}
