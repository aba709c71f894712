package com.deepansh.graphagent.graph;

import com.deepansh.graphagent.model.Message;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Snapshot of one thread's conversation as persisted in every checkpoint.
 * Messages only ever grow: {@link #merge} appends and returns a new snapshot.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConversationState {

    private List<Message> messages = new ArrayList<>();
    private String longTermMemoryContext;

    public static ConversationState empty() {
        return new ConversationState(new ArrayList<>(), null);
    }

    public ConversationState merge(List<Message> update) {
        List<Message> merged = new ArrayList<>(messages.size() + update.size());
        merged.addAll(messages);
        merged.addAll(update);
        return new ConversationState(merged, longTermMemoryContext);
    }

    public ConversationState withLongTermMemoryContext(String context) {
        return new ConversationState(new ArrayList<>(messages), context);
    }

    public int size() {
        return messages.size();
    }
}
