package com.deepansh.graphagent.graph;

import com.deepansh.graphagent.checkpoint.Checkpoint;
import com.deepansh.graphagent.checkpoint.CheckpointStore;
import com.deepansh.graphagent.checkpoint.ThreadLocks;
import com.deepansh.graphagent.config.AgentProperties;
import com.deepansh.graphagent.exception.MemoryUnavailableException;
import com.deepansh.graphagent.memory.LongTermMemory;
import com.deepansh.graphagent.model.Message;
import com.deepansh.graphagent.model.StreamChunk;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.function.Consumer;

/**
 * Turn orchestration around {@link AgentGraph}.
 *
 * Per turn:
 * 1. Search long-term memory with the latest user message (placeholder on miss or failure)
 * 2. Run the graph under the thread's lock, one checkpoint per step
 * 3. Queue a background long-term memory update with the full message list
 * 4. Return the user/assistant messages with content produced this turn
 */
@Service
@Slf4j
public class AgentLoop {

    private final AgentGraph graph;
    private final CheckpointStore checkpointStore;
    private final ThreadLocks threadLocks;
    private final LongTermMemory longTermMemory;
    private final AgentProperties properties;

    public AgentLoop(AgentGraph graph,
                     CheckpointStore checkpointStore,
                     ThreadLocks threadLocks,
                     LongTermMemory longTermMemory,
                     AgentProperties properties) {
        this.graph = graph;
        this.checkpointStore = checkpointStore;
        this.threadLocks = threadLocks;
        this.longTermMemory = longTermMemory;
        this.properties = properties;
    }

    public List<Message> getResponse(List<Message> messages, String threadId, String userId) {
        return runTurn(messages, threadId, userId, StepListener.NONE).transcriptDelta();
    }

    /**
     * Same turn as {@link #getResponse}; every assistant reply with content is pushed to
     * the sink as it is checkpointed, followed by exactly one finished chunk.
     */
    public void streamResponse(List<Message> messages, String threadId, String userId, Consumer<StreamChunk> sink) {
        runTurn(messages, threadId, userId, (node, command, step) -> command.update().stream()
                .filter(m -> m.getRole() == Message.Role.assistant && m.isTranscriptEntry())
                .forEach(m -> sink.accept(StreamChunk.content(m.getContent()))));
        sink.accept(StreamChunk.finished());
    }

    public List<Message> getChatHistory(String threadId) {
        return checkpointStore.getLatest(threadId)
                .map(Checkpoint::getState)
                .map(state -> state.getMessages().stream().filter(Message::isTranscriptEntry).toList())
                .orElse(List.of());
    }

    /**
     * Starts the thread over by appending an empty snapshot; earlier checkpoints are kept.
     */
    public void clearChatHistory(String threadId) {
        long step = threadLocks.withLock(threadId,
                () -> checkpointStore.append(threadId, ConversationState.empty(), GraphNode.TERMINAL));
        log.info("Chat history cleared [threadId={}, step={}]", threadId, step);
    }

    private GraphRun runTurn(List<Message> messages, String threadId, String userId, StepListener listener) {
        log.info("Turn started [threadId={}, userId={}, inputMessages={}]", threadId, userId, messages.size());
        long start = System.currentTimeMillis();

        String memoryContext = searchMemory(messages, userId);

        GraphRun run = threadLocks.withLock(threadId,
                () -> graph.invoke(threadId, messages, memoryContext, listener));

        longTermMemory.addInBackground(run.state().getMessages(), userId);

        log.info("Turn complete [threadId={}, steps={}, messages={}, latency={}ms]",
                threadId, run.steps(), run.state().size(), System.currentTimeMillis() - start);
        return run;
    }

    private String searchMemory(List<Message> messages, String userId) {
        String placeholder = properties.getLongTerm().getNoMemoryPlaceholder();
        String query = latestUserContent(messages);
        if (query == null) {
            return placeholder;
        }
        try {
            return longTermMemory.formatForPrompt(longTermMemory.search(userId, query));
        } catch (MemoryUnavailableException e) {
            log.warn("Long-term memory unavailable, continuing without it [userId={}]: {}",
                    userId, e.getMessage());
            return placeholder;
        }
    }

    private String latestUserContent(List<Message> messages) {
        for (int i = messages.size() - 1; i >= 0; i--) {
            Message m = messages.get(i);
            if (m.getRole() == Message.Role.user && m.getContent() != null && !m.getContent().isBlank()) {
                return m.getContent();
            }
        }
        return null;
    }
}
