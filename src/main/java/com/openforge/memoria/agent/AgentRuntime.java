package com.openforge.memoria.agent;

import com.openforge.memoria.agent.prompt.PromptBuilder;
import com.openforge.memoria.session.SessionRegistry;
import com.openforge.memoria.session.SessionStore;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Collaborators shared by every extraction agent.
 */
@Component
public record AgentRuntime(
        SessionRegistry   registry,
        SessionStore      sessionStore,
        PromptBuilder     prompts,
        ResponseProcessor responses,
        HistoryTruncator  history,
        Clock             clock
) {}
