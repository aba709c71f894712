package com.deepansh.graphagent.graph;

import com.deepansh.graphagent.model.Message;

import java.util.List;

/**
 * Outcome of one node: the node to run next and the messages to merge into the state.
 */
public record Command(GraphNode next, List<Message> update) {

    public Command {
        update = List.copyOf(update);
    }

    public static Command goTo(GraphNode next, List<Message> update) {
        return new Command(next, update);
    }
}
