package com.deepansh.graphagent.llm;

import com.deepansh.graphagent.model.Message;

import java.util.List;

/**
 * Counts tokens the way a particular backend would bill a message list.
 */
@FunctionalInterface
public interface TokenCounter {

    int count(List<Message> messages);
}
