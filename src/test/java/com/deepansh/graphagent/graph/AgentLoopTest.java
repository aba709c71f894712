package com.deepansh.graphagent.graph;

import com.deepansh.graphagent.checkpoint.Checkpoint;
import com.deepansh.graphagent.checkpoint.CheckpointStore;
import com.deepansh.graphagent.checkpoint.ThreadLocks;
import com.deepansh.graphagent.config.AgentProperties;
import com.deepansh.graphagent.exception.AllBackendsExhaustedException;
import com.deepansh.graphagent.exception.MemoryUnavailableException;
import com.deepansh.graphagent.memory.LongTermMemory;
import com.deepansh.graphagent.model.Message;
import com.deepansh.graphagent.model.StreamChunk;
import com.deepansh.graphagent.model.ToolCall;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AgentLoopTest {

    @Mock AgentGraph graph;
    @Mock CheckpointStore checkpointStore;
    @Mock LongTermMemory longTermMemory;

    private AgentLoop agentLoop;

    @BeforeEach
    void setUp() {
        agentLoop = new AgentLoop(graph, checkpointStore, new ThreadLocks(4), longTermMemory, new AgentProperties());
    }

    @Test
    void getResponse_searchesMemoryRunsGraphAndQueuesUpdate() {
        List<Message> input = List.of(Message.user("What is 2+2?"));
        when(longTermMemory.search("u1", "What is 2+2?")).thenReturn(List.of());
        when(longTermMemory.formatForPrompt(List.of())).thenReturn("No relevant memory found.");
        GraphRun run = run(input, Message.assistant("4"));
        when(graph.invoke(eq("t1"), eq(input), eq("No relevant memory found."), any())).thenReturn(run);

        List<Message> result = agentLoop.getResponse(input, "t1", "u1");

        assertThat(result).containsExactly(Message.assistant("4"));
        verify(longTermMemory).addInBackground(run.state().getMessages(), "u1");
    }

    @Test
    void getResponse_usesLatestUserMessageAsMemoryQuery() {
        List<Message> input = List.of(Message.user("first"), Message.assistant("reply"), Message.user("latest"));
        when(longTermMemory.search("u1", "latest")).thenReturn(List.of("Loves hiking"));
        when(longTermMemory.formatForPrompt(List.of("Loves hiking"))).thenReturn("* Loves hiking");
        when(graph.invoke(eq("t1"), eq(input), eq("* Loves hiking"), any()))
                .thenReturn(run(input, Message.assistant("ok")));

        agentLoop.getResponse(input, "t1", "u1");

        verify(graph).invoke(eq("t1"), eq(input), eq("* Loves hiking"), any());
    }

    @Test
    void getResponse_memoryUnavailable_degradesToPlaceholder() {
        List<Message> input = List.of(Message.user("hi"));
        when(longTermMemory.search("u1", "hi"))
                .thenThrow(new MemoryUnavailableException("mongo down", new RuntimeException()));
        when(graph.invoke(eq("t1"), eq(input), eq("No relevant memory found."), any()))
                .thenReturn(run(input, Message.assistant("hello")));

        List<Message> result = agentLoop.getResponse(input, "t1", "u1");

        assertThat(result).extracting(Message::getContent).containsExactly("hello");
    }

    @Test
    void getResponse_noUserMessage_skipsMemorySearch() {
        List<Message> input = List.of(Message.system("be brief"));
        when(graph.invoke(eq("t1"), eq(input), eq("No relevant memory found."), any()))
                .thenReturn(run(input, Message.assistant("ok")));

        agentLoop.getResponse(input, "t1", "u1");

        verify(longTermMemory, never()).search(anyString(), anyString());
    }

    @Test
    void getResponse_filtersToolTrafficFromTranscript() {
        List<Message> input = List.of(Message.user("look it up"));
        ToolCall call = ToolCall.builder().id("call_1").toolName("query_knowledge_base").arguments(Map.of()).build();
        Message toolRequest = Message.builder().role(Message.Role.assistant).toolCalls(List.of(call)).build();
        Message toolResult = Message.toolResult(call, "kb says hi");
        when(longTermMemory.search(anyString(), anyString())).thenReturn(List.of());
        when(longTermMemory.formatForPrompt(anyList())).thenReturn("No relevant memory found.");
        when(graph.invoke(anyString(), anyList(), anyString(), any()))
                .thenReturn(run(input, toolRequest, toolResult, Message.assistant("It says hi")));

        List<Message> result = agentLoop.getResponse(input, "t1", "u1");

        assertThat(result).containsExactly(Message.assistant("It says hi"));
    }

    @Test
    void getResponse_graphFails_noMemoryUpdateQueued() {
        List<Message> input = List.of(Message.user("hi"));
        when(longTermMemory.search("u1", "hi")).thenReturn(List.of());
        when(longTermMemory.formatForPrompt(List.of())).thenReturn("No relevant memory found.");
        when(graph.invoke(anyString(), anyList(), anyString(), any()))
                .thenThrow(new AllBackendsExhaustedException(List.of("A", "B"), null));

        assertThatThrownBy(() -> agentLoop.getResponse(input, "t1", "u1"))
                .isInstanceOf(AllBackendsExhaustedException.class);

        verify(longTermMemory, never()).addInBackground(anyList(), anyString());
    }

    @Test
    void streamResponse_emitsAssistantContentThenExactlyOneDone() {
        List<Message> input = List.of(Message.user("hi"));
        when(longTermMemory.search("u1", "hi")).thenReturn(List.of());
        when(longTermMemory.formatForPrompt(List.of())).thenReturn("No relevant memory found.");
        ToolCall call = ToolCall.builder().id("call_1").toolName("query_knowledge_base").arguments(Map.of()).build();
        when(graph.invoke(eq("t1"), eq(input), anyString(), any())).thenAnswer(inv -> {
            StepListener listener = inv.getArgument(3);
            Message toolRequest = Message.builder().role(Message.Role.assistant).toolCalls(List.of(call)).build();
            listener.onStep(GraphNode.RESPOND, Command.goTo(GraphNode.TOOLCALL, List.of(toolRequest)), 1);
            listener.onStep(GraphNode.TOOLCALL,
                    Command.goTo(GraphNode.RESPOND, List.of(Message.toolResult(call, "raw tool output"))), 2);
            listener.onStep(GraphNode.RESPOND,
                    Command.goTo(GraphNode.TERMINAL, List.of(Message.assistant("Hello there"))), 3);
            return run(input, toolRequest, Message.assistant("Hello there"));
        });
        List<StreamChunk> chunks = new ArrayList<>();

        agentLoop.streamResponse(input, "t1", "u1", chunks::add);

        assertThat(chunks).containsExactly(StreamChunk.content("Hello there"), StreamChunk.finished());
    }

    @Test
    void getChatHistory_returnsUserAndAssistantMessagesWithContent() {
        ToolCall call = ToolCall.builder().id("call_1").toolName("query_knowledge_base").arguments(Map.of()).build();
        ConversationState state = ConversationState.empty().merge(List.of(
                Message.user("q"),
                Message.builder().role(Message.Role.assistant).toolCalls(List.of(call)).build(),
                Message.toolResult(call, "raw"),
                Message.assistant("answer")));
        when(checkpointStore.getLatest("t1")).thenReturn(Optional.of(
                Checkpoint.builder().threadId("t1").step(3).state(state).nextNode(GraphNode.TERMINAL).build()));

        assertThat(agentLoop.getChatHistory("t1")).extracting(Message::getContent).containsExactly("q", "answer");
    }

    @Test
    void getChatHistory_unknownThread_isEmpty() {
        when(checkpointStore.getLatest("nope")).thenReturn(Optional.empty());

        assertThat(agentLoop.getChatHistory("nope")).isEmpty();
    }

    @Test
    void clearChatHistory_appendsEmptyTerminalSnapshot() {
        when(checkpointStore.append(eq("t1"), any(ConversationState.class), eq(GraphNode.TERMINAL))).thenReturn(4L);

        agentLoop.clearChatHistory("t1");

        verify(checkpointStore).append(eq("t1"),
                argThat(state -> state.getMessages().isEmpty()), eq(GraphNode.TERMINAL));
    }

    private GraphRun run(List<Message> input, Message... produced) {
        List<Message> all = new ArrayList<>(input);
        all.addAll(List.of(produced));
        return new GraphRun(new ConversationState(all, null), List.of(produced), 1);
    }
}
