package com.openforge.memoria.agent;

import com.openforge.memoria.session.ConversationMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Bounds the conversation a session keeps and replays to stateless providers.
 *
 * Walks the history newest-first and keeps messages until either the message
 * cap or the estimated-token cap would be exceeded; everything older is
 * dropped. The newest message, the prompt about to be sent, is kept even
 * when it alone exceeds the token cap. The order of the kept messages is
 * unchanged.
 */
@Slf4j
@Component
public class HistoryTruncator {

    private static final int CHARS_PER_TOKEN = 4;

    private final int maxMessages;
    private final int maxTokens;

    public HistoryTruncator(int maxMessages, int maxTokens) {
        this.maxMessages = maxMessages;
        this.maxTokens   = maxTokens;
    }

    public HistoryTruncator(AgentProperties.History history) {
        this(history.maxContextMessages(), history.maxEstimatedTokens());
    }

    @Autowired
    public HistoryTruncator(AgentProperties properties) {
        this(properties.history());
    }

    public static int estimateTokens(String text) {
        if (text == null || text.isEmpty()) return 0;
        return (text.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
    }

    public List<ConversationMessage> truncate(List<ConversationMessage> history) {
        int keep = keepCount(history);
        if (keep == history.size()) {
            return List.copyOf(history);
        }
        log.warn("[History] Context truncated original={} kept={} dropped={} limit={}",
                history.size(), keep, history.size() - keep, maxTokens);
        return List.copyOf(history.subList(history.size() - keep, history.size()));
    }

    /**
     * Drop the oldest entries of a stored history in place, under the same caps.
     *
     * @return number of entries removed
     */
    public int trim(List<ConversationMessage> history) {
        int drop = history.size() - keepCount(history);
        if (drop > 0) {
            history.subList(0, drop).clear();
        }
        return drop;
    }

    /** Newest-first count of messages within both caps; the newest message is always kept. */
    private int keepCount(List<ConversationMessage> history) {
        if (history.size() <= maxMessages && totalTokens(history) <= maxTokens) {
            return history.size();
        }
        int kept = 0;
        int tokens = 0;
        for (int i = history.size() - 1; i >= 0; i--) {
            int messageTokens = estimateTokens(history.get(i).content());
            if (kept > 0 && (kept >= maxMessages || tokens + messageTokens > maxTokens)) {
                break;
            }
            kept++;
            tokens += messageTokens;
        }
        return kept;
    }

    private static int totalTokens(List<ConversationMessage> history) {
        int total = 0;
        for (ConversationMessage message : history) {
            total += estimateTokens(message.content());
        }
        return total;
    }
}
