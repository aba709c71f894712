package com.deepansh.graphagent.model;

/**
 * One fragment of a streamed turn. Exactly one chunk per stream has {@code done = true},
 * and it is always the last one.
 */
public record StreamChunk(String content, boolean done) {

    public static StreamChunk content(String content) {
        return new StreamChunk(content, false);
    }

    public static StreamChunk finished() {
        return new StreamChunk("", true);
    }
}
