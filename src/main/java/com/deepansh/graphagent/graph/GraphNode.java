package com.deepansh.graphagent.graph;

/**
 * Nodes of the agent graph. RESPOND is the entry point, TERMINAL ends the turn.
 */
public enum GraphNode {
    RESPOND,
    TOOLCALL,
    TERMINAL
}
