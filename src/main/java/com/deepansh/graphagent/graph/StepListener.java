package com.deepansh.graphagent.graph;

/**
 * Observes each step once its checkpoint has been written.
 */
@FunctionalInterface
public interface StepListener {

    StepListener NONE = (node, command, step) -> { };

    void onStep(GraphNode node, Command command, long step);
}
