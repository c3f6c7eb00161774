package com.openforge.memoria.queue;

/**
 * Producer-supplied content of a queued message.
 *
 * Observation messages carry the tool triple; summarize messages carry the
 * assistant's last message. cwd and promptNumber apply to both.
 */
public record MessagePayload(
        String toolName,
        String toolInput,
        String toolResponse,
        String lastAssistantMessage,
        String cwd,
        Integer promptNumber
) {

    public static MessagePayload observation(String toolName, String toolInput, String toolResponse,
                                             String cwd, Integer promptNumber) {
        return new MessagePayload(toolName, toolInput, toolResponse, null, cwd, promptNumber);
    }

    public static MessagePayload summarize(String lastAssistantMessage, String cwd, Integer promptNumber) {
        return new MessagePayload(null, null, null, lastAssistantMessage, cwd, promptNumber);
    }
}
