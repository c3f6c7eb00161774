package com.openforge.memoria.agent;

/**
 * One provider answer.
 *
 * @param text              raw model output, empty when the provider returned nothing
 * @param providerSessionId resumable provider conversation id, null for stateless providers
 */
public record AgentReply(String text, String providerSessionId) {

    public static AgentReply of(String text) {
        return new AgentReply(text == null ? "" : text.trim(), null);
    }

    public boolean isEmpty() {
        return text == null || text.isBlank();
    }
}
