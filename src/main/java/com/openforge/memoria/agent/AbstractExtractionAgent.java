package com.openforge.memoria.agent;

import com.openforge.memoria.domain.MessageKind;
import com.openforge.memoria.domain.PendingMessage;
import com.openforge.memoria.session.CancellationToken;
import com.openforge.memoria.session.ConversationMessage;
import com.openforge.memoria.session.SessionContext;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * The consume loop shared by every provider.
 *
 * A run sends the init prompt (or the continuation prompt when the session
 * is past its first user prompt), then one prompt per queued message until
 * the message sequence ends. Each reply is stored together with the
 * completion of the message it answers; the opening reply completes
 * nothing. Subclasses only implement the
 * provider round trip in {@link #query}.
 *
 * The memory-session id is settled after the first successful reply and
 * before anything is stored: the provider's own session id when it has one,
 * otherwise {@code <provider>-<contentSessionId>-<epochMs>}.
 */
@Slf4j
public abstract class AbstractExtractionAgent implements ExtractionAgent {

    protected final AgentRuntime runtime;

    protected AbstractExtractionAgent(AgentRuntime runtime) {
        this.runtime = runtime;
    }

    @Override
    public final void startSession(SessionContext context, CancellationToken token) {
        long startedAt = runtime.clock().millis();
        log.info("[Agent:{}] Starting session={} promptNumber={} historyLength={}",
                name(), context.getSessionDbId(), context.getLastPromptNumber(),
                context.getConversationHistory().size());
        try {
            ensureReady();

            String opening = context.getLastPromptNumber() <= 1
                    ? runtime.prompts().init(context)
                    : runtime.prompts().continuation(context);
            AgentReply openingReply = exchange(context, token, opening, null, List.of());
            if (openingReply.isEmpty()) {
                log.warn("[Agent:{}] Empty reply to opening prompt, session={} may lack context",
                        name(), context.getSessionDbId());
            }

            for (PendingMessage message : runtime.registry().messages(context, token)) {
                Long originalTimestamp = context.getEarliestPendingTimestamp();
                String prompt;
                if (message.getKind() == MessageKind.SUMMARIZE) {
                    prompt = runtime.prompts().summary(context, message);
                } else {
                    if (message.getPromptNumber() != null) {
                        context.setLastPromptNumber(message.getPromptNumber());
                    }
                    prompt = runtime.prompts().observation(message);
                }
                exchange(context, token, prompt, originalTimestamp, List.of(message.getId()));
            }

            token.throwIfCancelled();
            log.info("[Agent:{}] Completed session={} duration={}ms historyLength={}",
                    name(), context.getSessionDbId(), runtime.clock().millis() - startedAt,
                    context.getConversationHistory().size());
        } catch (AgentException e) {
            throw e;
        } catch (RuntimeException e) {
            if (token.isCancelled()) {
                AgentCancelledException cancelled = new AgentCancelledException("Cancelled: " + token.reason());
                cancelled.initCause(e);
                throw cancelled;
            }
            throw ErrorClassifier.classify(e);
        }
    }

    /**
     * One prompt/reply round trip plus storage of the reply.
     */
    private AgentReply exchange(SessionContext context, CancellationToken token, String prompt,
                                Long originalTimestamp, List<Long> answeredMessageIds) {
        token.throwIfCancelled();
        context.getConversationHistory().add(ConversationMessage.user(prompt));

        AgentReply reply = query(context, token, prompt);

        if (!reply.isEmpty()) {
            context.getConversationHistory().add(ConversationMessage.assistant(reply.text()));
        }
        int tokensUsed = estimateTokens(reply.text());
        context.addTokens(tokensUsed);

        ensureMemorySessionId(context, reply);
        runtime.responses().process(context, reply.text(), tokensUsed, originalTimestamp, answeredMessageIds, name());
        int dropped = runtime.history().trim(context.getConversationHistory());
        if (dropped > 0) {
            log.debug("[Agent:{}] Dropped {} old history entries session={}", name(), dropped, context.getSessionDbId());
        }
        return reply;
    }

    private void ensureMemorySessionId(SessionContext context, AgentReply reply) {
        if (context.getMemorySessionId() != null) {
            return;
        }
        String candidate = reply.providerSessionId() != null
                ? reply.providerSessionId()
                : name() + "-" + context.getContentSessionId() + "-" + runtime.clock().millis();
        String effective = runtime.sessionStore().assignMemorySessionId(context.getSessionDbId(), candidate);
        context.setMemorySessionId(effective);
        log.info("[Agent:{}] MEMORY_ID_GENERATED sessionDbId={} memorySessionId={}",
                name(), context.getSessionDbId(), effective);
    }

    /** Verify configuration before the first call; throw {@link FatalAgentException} if it can never work. */
    protected void ensureReady() {
    }

    /**
     * Send {@code prompt} to the provider. The prompt has already been
     * appended to the context's conversation history.
     */
    protected abstract AgentReply query(SessionContext context, CancellationToken token, String prompt);
}
