package com.openforge.memoria.worker;

import com.openforge.memoria.domain.MessageKind;
import com.openforge.memoria.domain.SdkSession;
import com.openforge.memoria.event.WorkerEvent;
import com.openforge.memoria.event.WorkerEventPublisher;
import com.openforge.memoria.process.ProcessRegistry;
import com.openforge.memoria.queue.MessagePayload;
import com.openforge.memoria.queue.PendingMessageStore;
import com.openforge.memoria.session.ProcessorState;
import com.openforge.memoria.session.SessionContext;
import com.openforge.memoria.session.SessionRegistry;
import com.openforge.memoria.session.SessionStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Producer side of the queue: session init, enqueue, completion and status.
 *
 * Every enqueue wakes the session's consumer and starts one if none is
 * attached.
 */
@Slf4j
@Service
public class SessionService {

    private final SessionStore         sessionStore;
    private final PendingMessageStore  messageStore;
    private final SessionRegistry      registry;
    private final SessionProcessor     processor;
    private final ProcessRegistry      processRegistry;
    private final WorkerEventPublisher publisher;
    private final Set<String>          skipTools;
    private final Clock                clock;

    public SessionService(SessionStore sessionStore,
                          PendingMessageStore messageStore,
                          SessionRegistry registry,
                          SessionProcessor processor,
                          ProcessRegistry processRegistry,
                          WorkerEventPublisher publisher,
                          WorkerProperties properties,
                          Clock clock) {
        this.sessionStore    = sessionStore;
        this.messageStore    = messageStore;
        this.registry        = registry;
        this.processor       = processor;
        this.processRegistry = processRegistry;
        this.publisher       = publisher;
        this.skipTools       = Set.copyOf(properties.skipTools());
        this.clock           = clock;
    }

    // ── Init ─────────────────────────────────────────────────────────────────

    public InitResult init(String contentSessionId, String project, String prompt) {
        requireAccepting();
        SdkSession session = sessionStore.registerPrompt(contentSessionId, project, prompt);
        registry.get(session.getId()).ifPresent(context -> {
            context.setUserPrompt(session.getUserPrompt());
            context.setLastPromptNumber(session.getPromptCounter());
        });
        log.info("[Ingest] Prompt #{} for session {} ({})",
                session.getPromptCounter(), session.getId(), contentSessionId);
        return new InitResult(session.getId(), session.getPromptCounter());
    }

    // ── Enqueue ──────────────────────────────────────────────────────────────

    public QueueResult queueObservation(String contentSessionId, String toolName, String toolInput,
                                        String toolResponse, String cwd) {
        requireAccepting();
        if (toolName != null && skipTools.contains(toolName)) {
            log.debug("[Ingest] Skipping tool {} for {}", toolName, contentSessionId);
            return QueueResult.skipped();
        }
        SdkSession session = sessionStore.findOrCreate(contentSessionId, null, null);
        Long messageId = messageStore.enqueue(session, MessageKind.OBSERVATION,
                MessagePayload.observation(toolName, toolInput, toolResponse, cwd, promptNumber(session)));
        ensureProcessor(session);
        return QueueResult.queued(messageId);
    }

    public QueueResult queueSummarize(String contentSessionId, String lastAssistantMessage, String cwd) {
        requireAccepting();
        SdkSession session = sessionStore.findOrCreate(contentSessionId, null, null);
        Long messageId = messageStore.enqueue(session, MessageKind.SUMMARIZE,
                MessagePayload.summarize(lastAssistantMessage, cwd, promptNumber(session)));
        ensureProcessor(session);
        return QueueResult.queued(messageId);
    }

    private void ensureProcessor(SdkSession session) {
        SessionContext context = registry.getOrCreate(session.getContentSessionId());
        registry.notifyEnqueued(session.getId());
        processor.start(context, "enqueue");
    }

    private static int promptNumber(SdkSession session) {
        return Math.max(1, session.getPromptCounter());
    }

    // ── Completion ───────────────────────────────────────────────────────────

    /**
     * The owner closed the session: stop its consumer, mark it completed and
     * drop the live context. Messages still queued stay queued.
     *
     * @return false if no such session exists
     */
    public boolean complete(String contentSessionId) {
        Optional<SdkSession> session = sessionStore.findByContentSessionId(contentSessionId);
        if (session.isEmpty()) {
            return false;
        }
        Long sessionDbId = session.get().getId();
        registry.remove(sessionDbId);
        processRegistry.killSession(sessionDbId);
        if (sessionStore.markCompleted(sessionDbId)) {
            log.info("[Ingest] Session {} ({}) completed", sessionDbId, contentSessionId);
            publisher.publish(WorkerEvent.sessionCompleted(sessionDbId, clock.millis()));
        }
        return true;
    }

    // ── Status ───────────────────────────────────────────────────────────────

    public Optional<SessionStatusView> status(String contentSessionId) {
        return sessionStore.findByContentSessionId(contentSessionId).map(session -> {
            Optional<SessionContext> context = registry.get(session.getId());
            return new SessionStatusView(
                    session.getId(),
                    contentSessionId,
                    session.getMemorySessionId(),
                    session.getStatus().dbValue(),
                    session.getPromptCounter(),
                    messageStore.pendingCount(session.getId()),
                    context.map(SessionContext::getState).orElse(ProcessorState.IDLE).name().toLowerCase(Locale.ROOT),
                    context.map(SessionContext::getProviderName).orElse(null));
        });
    }

    private void requireAccepting() {
        if (!processor.isAccepting()) {
            throw new WorkerNotAcceptingException();
        }
    }

    // ── Results ──────────────────────────────────────────────────────────────

    public record InitResult(Long sessionDbId, int promptNumber) {}

    public record QueueResult(String status, Long messageId) {
        static QueueResult queued(Long messageId) {
            return new QueueResult("queued", messageId);
        }

        static QueueResult skipped() {
            return new QueueResult("skipped", null);
        }
    }

    public record SessionStatusView(
            Long sessionDbId,
            String contentSessionId,
            String memorySessionId,
            String status,
            int promptNumber,
            long queueDepth,
            String processorState,
            String provider
    ) {}
}
