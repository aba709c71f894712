package com.deepansh.graphagent.llm;

import com.deepansh.graphagent.model.Message;
import com.deepansh.graphagent.model.ToolCall;

import java.util.List;

/**
 * Character-ratio estimate plus a fixed per-message overhead for role and framing.
 */
public class ApproximateTokenCounter implements TokenCounter {

    private static final int PER_MESSAGE_OVERHEAD = 4;

    private final double charsPerToken;

    public ApproximateTokenCounter(double charsPerToken) {
        if (charsPerToken <= 0) {
            throw new IllegalArgumentException("charsPerToken must be positive: " + charsPerToken);
        }
        this.charsPerToken = charsPerToken;
    }

    @Override
    public int count(List<Message> messages) {
        int total = 0;
        for (Message message : messages) {
            total += PER_MESSAGE_OVERHEAD + estimate(message.getContent());
            if (message.hasToolCalls()) {
                for (ToolCall call : message.getToolCalls()) {
                    total += estimate(call.getToolName());
                    total += estimate(call.getArguments() != null ? call.getArguments().toString() : null);
                }
            }
        }
        return total;
    }

    private int estimate(String text) {
        if (text == null || text.isEmpty()) return 0;
        return (int) Math.ceil(text.length() / charsPerToken);
    }
}
