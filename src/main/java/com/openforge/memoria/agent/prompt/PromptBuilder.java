package com.openforge.memoria.agent.prompt;

import com.openforge.memoria.domain.PendingMessage;
import com.openforge.memoria.session.SessionContext;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * The four prompt shapes sent to extraction providers.
 *
 *   init          — first prompt of a session (prompt number 1)
 *   continuation  — first prompt of a consumer run later in the conversation
 *   observation   — one tool execution to record
 *   summary       — end-of-turn digest request
 *
 * All shapes ask for the same XML blocks so that one parser handles every
 * provider.
 */
@Component
public class PromptBuilder {

    private static final String OBSERVATION_FORMAT = """
            <observation>
              <type>one of: bugfix, feature, refactor, change, discovery, decision</type>
              <title>short title of what happened</title>
              <subtitle>one sentence of context</subtitle>
              <facts>
                <fact>a concrete, self-contained fact</fact>
              </facts>
              <narrative>what was done and why it matters</narrative>
              <concepts>
                <concept>a key concept touched by the work</concept>
              </concepts>
              <files_read>
                <file>path/of/file/read</file>
              </files_read>
              <files_modified>
                <file>path/of/file/changed</file>
              </files_modified>
            </observation>
            """;

    private static final String SUMMARY_FORMAT = """
            <summary>
              <request>what the user asked for</request>
              <investigated>what was examined</investigated>
              <learned>what was learned</learned>
              <completed>what was finished</completed>
              <next_steps>what remains</next_steps>
              <notes>anything else worth remembering</notes>
            </summary>
            """;

    public String init(SessionContext context) {
        return """
                You are a memory observer for a coding session. You watch the tool \
                executions of another assistant and record what was learned or changed.

                Project: %s
                Session: %s
                User request:
                %s

                For every tool execution sent to you, answer with zero or more \
                observation blocks in exactly this format, and nothing else:

                %s
                Skip routine or empty operations by answering with no blocks at all.
                """.formatted(context.getProject(), context.getContentSessionId(),
                nullToEmpty(context.getUserPrompt()), OBSERVATION_FORMAT);
    }

    public String continuation(SessionContext context) {
        return """
                The user sent prompt #%d in session %s:
                %s

                Continue recording observations for the tool executions that follow, \
                using the same observation format as before:

                %s""".formatted(context.getLastPromptNumber(), context.getContentSessionId(),
                nullToEmpty(context.getUserPrompt()), OBSERVATION_FORMAT);
    }

    public String observation(PendingMessage message) {
        StringBuilder prompt = new StringBuilder()
                .append("<tool_used>\n")
                .append("  <tool_name>").append(nullToEmpty(message.getToolName())).append("</tool_name>\n")
                .append("  <occurred_at>").append(Instant.ofEpochMilli(message.getCreatedAtEpoch())).append("</occurred_at>\n");
        if (message.getCwd() != null && !message.getCwd().isBlank()) {
            prompt.append("  <working_directory>").append(message.getCwd()).append("</working_directory>\n");
        }
        return prompt
                .append("  <parameters>").append(nullToEmpty(message.getToolInput())).append("</parameters>\n")
                .append("  <outcome>").append(nullToEmpty(message.getToolResponse())).append("</outcome>\n")
                .append("</tool_used>")
                .toString();
    }

    public String summary(SessionContext context, PendingMessage message) {
        return """
                The assistant has finished responding to prompt #%d of project %s.
                Original request:
                %s

                Last assistant message:
                %s

                Summarize the progress of this session in exactly this format, and nothing else:

                %s""".formatted(context.getLastPromptNumber(), context.getProject(),
                nullToEmpty(context.getUserPrompt()), nullToEmpty(message.getLastAssistantMessage()),
                SUMMARY_FORMAT);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
