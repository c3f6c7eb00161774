package com.openforge.memoria.llm.model;

import java.util.List;

/**
 * Top-level response from /chat/completions.
 */
public record ChatResponse(
        String id,
        String model,
        List<Choice> choices,
        Usage usage
) {

    /** Text of the first choice, empty when the provider returned none. */
    public String firstContent() {
        if (choices == null || choices.isEmpty() || choices.get(0).message() == null) {
            return "";
        }
        String content = choices.get(0).message().content();
        return content == null ? "" : content;
    }

    public record Choice(int index, Message message, String finishReason) {}

    public record Usage(int promptTokens, int completionTokens, int totalTokens) {}
}
