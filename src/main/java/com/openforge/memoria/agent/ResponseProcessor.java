package com.openforge.memoria.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.memoria.agent.parse.ParsedObservation;
import com.openforge.memoria.agent.parse.ParsedSummary;
import com.openforge.memoria.agent.parse.ResponseParser;
import com.openforge.memoria.domain.Observation;
import com.openforge.memoria.domain.SessionSummary;
import com.openforge.memoria.event.WorkerEvent;
import com.openforge.memoria.event.WorkerEventPublisher;
import com.openforge.memoria.queue.PendingMessageStore;
import com.openforge.memoria.repository.ObservationRepository;
import com.openforge.memoria.repository.SessionSummaryRepository;
import com.openforge.memoria.session.SessionContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Persists what a provider reply contained and retires the messages that
 * produced it.
 *
 * Observations, the optional summary and the completion of the messages the
 * reply answers are written in one transaction; events are broadcast only
 * after it commits. A reply that answers no queued message (the opening
 * prompt) completes nothing.
 */
@Slf4j
@Service
public class ResponseProcessor {

    private final ResponseParser           parser;
    private final ObservationRepository    observationRepository;
    private final SessionSummaryRepository summaryRepository;
    private final PendingMessageStore      messageStore;
    private final WorkerEventPublisher     publisher;
    private final ObjectMapper             objectMapper;
    private final TransactionTemplate      transactionTemplate;
    private final Clock                    clock;

    public ResponseProcessor(ResponseParser parser,
                             ObservationRepository observationRepository,
                             SessionSummaryRepository summaryRepository,
                             PendingMessageStore messageStore,
                             WorkerEventPublisher publisher,
                             ObjectMapper objectMapper,
                             PlatformTransactionManager transactionManager,
                             Clock clock) {
        this.parser                = parser;
        this.observationRepository = observationRepository;
        this.summaryRepository     = summaryRepository;
        this.messageStore          = messageStore;
        this.publisher             = publisher;
        this.objectMapper          = objectMapper;
        this.transactionTemplate   = new TransactionTemplate(transactionManager);
        this.clock                 = clock;
    }

    /**
     * @param context           session being processed; its memory-session id must already be set
     * @param replyText         raw provider output (may be empty)
     * @param discoveryTokens   estimated tokens spent on this reply
     * @param originalTimestamp creation time of the oldest claimed message, used as the record time
     * @param answeredMessageIds queued messages this reply answers, empty for the opening prompt
     * @param providerName      for logging
     */
    public StoredRecords process(SessionContext context,
                                 String replyText,
                                 int discoveryTokens,
                                 Long originalTimestamp,
                                 List<Long> answeredMessageIds,
                                 String providerName) {
        String memorySessionId = context.getMemorySessionId();
        if (memorySessionId == null) {
            throw new IllegalStateException(
                    "Cannot store records for session " + context.getSessionDbId() + " without a memory-session id");
        }

        List<ParsedObservation> parsedObservations = parser.parseObservations(replyText);
        Optional<ParsedSummary> parsedSummary = parser.parseSummary(replyText);
        List<Long> messageIds = List.copyOf(answeredMessageIds);
        long createdAt = originalTimestamp != null ? originalTimestamp : clock.millis();

        StoredRecords stored = transactionTemplate.execute(status -> {
            List<Observation> observations = new ArrayList<>();
            for (ParsedObservation parsed : parsedObservations) {
                observations.add(observationRepository.save(toEntity(context, memorySessionId, parsed,
                        discoveryTokens, createdAt)));
            }
            SessionSummary summary = parsedSummary
                    .map(s -> summaryRepository.save(toEntity(context, memorySessionId, s, discoveryTokens, createdAt)))
                    .orElse(null);
            for (Long messageId : messageIds) {
                messageStore.complete(messageId);
            }
            return new StoredRecords(observations, summary, messageIds);
        });

        context.getProcessingMessageIds().removeAll(messageIds);
        if (context.getProcessingMessageIds().isEmpty()) {
            context.setEarliestPendingTimestamp(null);
        }

        log.debug("[Response:{}] provider={} observations={} summary={} completedMessages={}",
                context.getSessionDbId(), providerName, stored.observations().size(),
                stored.summary() != null, messageIds.size());

        long now = clock.millis();
        for (Observation observation : stored.observations()) {
            publisher.publish(WorkerEvent.observationStored(context.getSessionDbId(),
                    observation.getId(), observation.getTitle(), now));
        }
        if (stored.summary() != null) {
            publisher.publish(WorkerEvent.summaryStored(context.getSessionDbId(), stored.summary().getId(), now));
        }
        return stored;
    }

    // ── Mapping ──────────────────────────────────────────────────────────────

    private Observation toEntity(SessionContext context, String memorySessionId, ParsedObservation parsed,
                                 int discoveryTokens, long createdAt) {
        return Observation.builder()
                .memorySessionId(memorySessionId)
                .project(context.getProject())
                .type(parsed.type())
                .title(parsed.title())
                .subtitle(parsed.subtitle())
                .narrative(parsed.narrative())
                .facts(toJson(parsed.facts()))
                .concepts(toJson(parsed.concepts()))
                .filesRead(toJson(parsed.filesRead()))
                .filesModified(toJson(parsed.filesModified()))
                .promptNumber(context.getLastPromptNumber())
                .discoveryTokens(discoveryTokens)
                .createdAtEpoch(createdAt)
                .build();
    }

    private SessionSummary toEntity(SessionContext context, String memorySessionId, ParsedSummary parsed,
                                    int discoveryTokens, long createdAt) {
        return SessionSummary.builder()
                .memorySessionId(memorySessionId)
                .project(context.getProject())
                .request(parsed.request())
                .investigated(parsed.investigated())
                .learned(parsed.learned())
                .completed(parsed.completed())
                .nextSteps(parsed.nextSteps())
                .notes(parsed.notes())
                .promptNumber(context.getLastPromptNumber())
                .discoveryTokens(discoveryTokens)
                .createdAtEpoch(createdAt)
                .build();
    }

    private String toJson(List<String> values) {
        try {
            return objectMapper.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize list field", e);
        }
    }

    public record StoredRecords(List<Observation> observations, SessionSummary summary, List<Long> completedMessageIds) {}
}
