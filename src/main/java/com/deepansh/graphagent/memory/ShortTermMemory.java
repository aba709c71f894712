package com.deepansh.graphagent.memory;

import com.deepansh.graphagent.llm.TokenCounter;
import com.deepansh.graphagent.model.Message;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Short-term context window: the recent slice of a thread's history sent to the model.
 *
 * The window is the system prompt followed by the longest suffix of the history
 * that fits the token budget, cut so it always opens on a user message. Anything
 * else (assistant reply, tool result, mid-history system note) would hand the model
 * a reply whose request it never saw.
 *
 * The full history itself is never modified; it lives in the checkpoint log.
 */
@Component
@Slf4j
public class ShortTermMemory {

    public List<Message> window(List<Message> history,
                                Message systemPrompt,
                                int maxTokens,
                                TokenCounter counter) {
        try {
            return trim(history, systemPrompt, maxTokens, counter);
        } catch (Exception e) {
            log.warn("Token counting failed, sending untrimmed history of {} messages: {}",
                    history.size(), e.getMessage());
            return prepend(systemPrompt, history);
        }
    }

    private List<Message> trim(List<Message> history, Message systemPrompt, int maxTokens, TokenCounter counter) {
        List<Message> full = prepend(systemPrompt, history.subList(turnStart(history, 0), history.size()));
        if (counter.count(full) <= maxTokens) {
            return full;
        }

        int budget = maxTokens - counter.count(List.of(systemPrompt));

        // Walk back from the newest message while the suffix still fits
        int start = history.size();
        int used = 0;
        while (start > 0) {
            int cost = counter.count(List.of(history.get(start - 1)));
            if (used + cost > budget) break;
            used += cost;
            start--;
        }

        start = turnStart(history, start);

        List<Message> window = prepend(systemPrompt, history.subList(start, history.size()));
        log.debug("Trimmed history: {} -> {} messages (budget={} tokens)",
                history.size(), window.size() - 1, maxTokens);
        return window;
    }

    /** First user message at or after {@code from}, or the history size if there is none. */
    private int turnStart(List<Message> history, int from) {
        int start = from;
        while (start < history.size() && history.get(start).getRole() != Message.Role.user) {
            start++;
        }
        return start;
    }

    private List<Message> prepend(Message systemPrompt, List<Message> history) {
        List<Message> result = new ArrayList<>(history.size() + 1);
        result.add(systemPrompt);
        result.addAll(history);
        return result;
    }
}
