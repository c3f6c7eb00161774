package com.openforge.memoria.session;

/** One turn of the extraction conversation kept for history-replaying agents. */
public record ConversationMessage(Role role, String content) {

    public enum Role { USER, ASSISTANT }

    public static ConversationMessage user(String content) {
        return new ConversationMessage(Role.USER, content);
    }

    public static ConversationMessage assistant(String content) {
        return new ConversationMessage(Role.ASSISTANT, content);
    }
}
