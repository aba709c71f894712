package com.deepansh.graphagent.graph;

import com.deepansh.graphagent.model.Message;

import java.util.List;

/**
 * Result of driving a thread to TERMINAL.
 *
 * @param state    the final persisted state
 * @param produced messages the nodes added during this run, caller input excluded
 * @param steps    number of checkpoints written
 */
public record GraphRun(ConversationState state, List<Message> produced, int steps) {

    public List<Message> transcriptDelta() {
        return produced.stream().filter(Message::isTranscriptEntry).toList();
    }
}
