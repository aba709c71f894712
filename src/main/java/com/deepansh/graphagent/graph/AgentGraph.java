package com.deepansh.graphagent.graph;

import com.deepansh.graphagent.checkpoint.Checkpoint;
import com.deepansh.graphagent.checkpoint.CheckpointStore;
import com.deepansh.graphagent.config.AgentProperties;
import com.deepansh.graphagent.memory.ShortTermMemory;
import com.deepansh.graphagent.model.LlmResponse;
import com.deepansh.graphagent.model.Message;
import com.deepansh.graphagent.model.ToolCall;
import com.deepansh.graphagent.resilience.ModelDispatcher;
import com.deepansh.graphagent.tool.ToolRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The turn state machine.
 *
 * RESPOND  → TOOLCALL  when the model asks for one or more tools
 * RESPOND  → TERMINAL  otherwise
 * TOOLCALL → RESPOND   always, after one result message per requested call
 *
 * Every step merges its update into the thread's state and appends a checkpoint
 * before the next node runs. A thread whose latest checkpoint is not TERMINAL
 * continues from the node it recorded rather than replaying earlier steps.
 * The loop has no iteration cap.
 *
 * Callers must hold the thread's lock (see {@link com.deepansh.graphagent.checkpoint.ThreadLocks}).
 */
@Component
@Slf4j
public class AgentGraph {

    private final ModelDispatcher dispatcher;
    private final ToolRegistry toolRegistry;
    private final ShortTermMemory shortTermMemory;
    private final CheckpointStore checkpointStore;
    private final AgentProperties properties;

    public AgentGraph(ModelDispatcher dispatcher,
                      ToolRegistry toolRegistry,
                      ShortTermMemory shortTermMemory,
                      CheckpointStore checkpointStore,
                      AgentProperties properties) {
        this.dispatcher = dispatcher;
        this.toolRegistry = toolRegistry;
        this.shortTermMemory = shortTermMemory;
        this.checkpointStore = checkpointStore;
        this.properties = properties;
    }

    /**
     * Runs one turn: the input messages are merged into the first RESPOND step.
     */
    public GraphRun invoke(String threadId, List<Message> input, String memoryContext, StepListener listener) {
        Optional<Checkpoint> latest = checkpointStore.getLatest(threadId);
        ConversationState state = latest.map(Checkpoint::getState).orElseGet(ConversationState::empty)
                .withLongTermMemoryContext(memoryContext);

        GraphNode start = latest.filter(Checkpoint::isPending).map(Checkpoint::getNextNode).orElse(GraphNode.RESPOND);
        if (start != GraphNode.RESPOND) {
            log.info("Thread has a pending {} step, running it before the new input [threadId={}]", start, threadId);
        }
        return run(threadId, state, start, input, listener);
    }

    /**
     * Continues an interrupted thread from its latest checkpoint without new input.
     * A thread that is already TERMINAL (or unknown) is returned as is.
     */
    public GraphRun resume(String threadId, StepListener listener) {
        Optional<Checkpoint> latest = checkpointStore.getLatest(threadId);
        if (latest.isEmpty() || !latest.get().isPending()) {
            ConversationState state = latest.map(Checkpoint::getState).orElseGet(ConversationState::empty);
            return new GraphRun(state, List.of(), 0);
        }
        Checkpoint checkpoint = latest.get();
        log.info("Resuming thread from step {} at {} [threadId={}]",
                checkpoint.getStep(), checkpoint.getNextNode(), threadId);
        return run(threadId, checkpoint.getState(), checkpoint.getNextNode(), List.of(), listener);
    }

    private GraphRun run(String threadId,
                         ConversationState state,
                         GraphNode start,
                         List<Message> input,
                         StepListener listener) {
        List<Message> pendingInput = new ArrayList<>(input);
        List<Message> produced = new ArrayList<>();
        GraphNode node = start;
        int steps = 0;

        while (node != GraphNode.TERMINAL) {
            Command command = switch (node) {
                case RESPOND -> respond(state, pendingInput);
                case TOOLCALL -> executeTools(state);
                case TERMINAL -> throw new IllegalStateException("TERMINAL has no handler");
            };

            List<Message> update = command.update();
            if (node == GraphNode.RESPOND && !pendingInput.isEmpty()) {
                update = new ArrayList<>(pendingInput);
                update.addAll(command.update());
                pendingInput.clear();
            }

            state = state.merge(update);
            long step = checkpointStore.append(threadId, state, command.next());
            steps++;
            produced.addAll(command.update());

            log.debug("Step {} done: {} -> {} [threadId={}]", step, node, command.next(), threadId);
            listener.onStep(node, command, step);
            node = command.next();
        }

        return new GraphRun(state, produced, steps);
    }

    private Command respond(ConversationState state, List<Message> pendingInput) {
        List<Message> history = new ArrayList<>(state.getMessages());
        history.addAll(pendingInput);

        List<Message> window = shortTermMemory.window(
                history,
                systemPrompt(state.getLongTermMemoryContext()),
                properties.getShortTerm().getMaxTokens(),
                dispatcher.currentTokenCounter());

        LlmResponse response = dispatcher.call(window);
        Message reply = response.toMessage();

        if (response.isToolCallRequired()) {
            log.info("Model requested {} tool call(s): {}", response.getToolCalls().size(),
                    response.getToolCalls().stream().map(ToolCall::getToolName).toList());
            return Command.goTo(GraphNode.TOOLCALL, List.of(reply));
        }
        return Command.goTo(GraphNode.TERMINAL, List.of(reply));
    }

    private Command executeTools(ConversationState state) {
        List<Message> messages = state.getMessages();
        Message last = messages.isEmpty() ? null : messages.get(messages.size() - 1);

        if (last == null || last.getRole() != Message.Role.assistant || !last.hasToolCalls()) {
            log.warn("TOOLCALL scheduled without pending tool calls, returning to RESPOND");
            return Command.goTo(GraphNode.RESPOND, List.of());
        }

        List<Message> results = last.getToolCalls().stream()
                .map(toolRegistry::invoke)
                .toList();
        return Command.goTo(GraphNode.RESPOND, results);
    }

    private Message systemPrompt(String memoryContext) {
        String context = memoryContext == null || memoryContext.isBlank()
                ? properties.getLongTerm().getNoMemoryPlaceholder()
                : memoryContext;
        return Message.system(properties.getSystemPrompt().strip()
                + "\n\nWhat you remember about the user:\n" + context);
    }
}
