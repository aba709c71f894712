package com.deepansh.graphagent.api;

import com.deepansh.graphagent.exception.AllBackendsExhaustedException;
import com.deepansh.graphagent.exception.CheckpointWriteException;
import com.deepansh.graphagent.exception.GlobalExceptionHandler;
import com.deepansh.graphagent.graph.AgentLoop;
import com.deepansh.graphagent.model.Message;
import com.deepansh.graphagent.model.StreamChunk;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.SyncTaskExecutor;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ExtendWith(MockitoExtension.class)
class ChatControllerTest {

    private static final String TURN = """
            {"messages":[{"role":"user","content":"What is 2+2?"}],"threadId":"t1","userId":"u1"}
            """;

    @Mock AgentLoop agentLoop;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new ChatController(agentLoop, new SyncTaskExecutor()))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void chat_returnsTranscriptDelta() throws Exception {
        when(agentLoop.getResponse(List.of(Message.user("What is 2+2?")), "t1", "u1"))
                .thenReturn(List.of(Message.assistant("4")));

        mockMvc.perform(post("/api/v1/chatbot/chat").contentType(MediaType.APPLICATION_JSON).content(TURN))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.messages.length()").value(1))
                .andExpect(jsonPath("$.messages[0].role").value("assistant"))
                .andExpect(jsonPath("$.messages[0].content").value("4"));
    }

    @Test
    void chat_toolRole_rejected() throws Exception {
        String body = """
                {"messages":[{"role":"tool","content":"x"}],"threadId":"t1","userId":"u1"}
                """;

        mockMvc.perform(post("/api/v1/chatbot/chat").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_REQUEST"));

        verifyNoInteractions(agentLoop);
    }

    @Test
    void chat_contentTooLong_rejected() throws Exception {
        String body = "{\"messages\":[{\"role\":\"user\",\"content\":\"" + "a".repeat(3001)
                + "\"}],\"threadId\":\"t1\",\"userId\":\"u1\"}";

        mockMvc.perform(post("/api/v1/chatbot/chat").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest());
    }

    @Test
    void chat_missingThreadId_rejected() throws Exception {
        String body = """
                {"messages":[{"role":"user","content":"hi"}],"userId":"u1"}
                """;

        mockMvc.perform(post("/api/v1/chatbot/chat").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest());
    }

    @Test
    void chat_allBackendsExhausted_returns503() throws Exception {
        when(agentLoop.getResponse(anyList(), eq("t1"), eq("u1")))
                .thenThrow(new AllBackendsExhaustedException(List.of("gpt-5-mini", "gpt-4o"), null));

        mockMvc.perform(post("/api/v1/chatbot/chat").contentType(MediaType.APPLICATION_JSON).content(TURN))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.code").value("BACKENDS_EXHAUSTED"));
    }

    @Test
    void chat_checkpointWriteFailed_returnsDistinct500() throws Exception {
        when(agentLoop.getResponse(anyList(), eq("t1"), eq("u1")))
                .thenThrow(new CheckpointWriteException("t1", "Checkpoint write failed", null));

        mockMvc.perform(post("/api/v1/chatbot/chat").contentType(MediaType.APPLICATION_JSON).content(TURN))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value("STATE_NOT_PERSISTED"));
    }

    @Test
    void chatStream_writesChunksEndingWithDone() throws Exception {
        doAnswer(inv -> {
            Consumer<StreamChunk> sink = inv.getArgument(3);
            sink.accept(StreamChunk.content("4"));
            sink.accept(StreamChunk.finished());
            return null;
        }).when(agentLoop).streamResponse(anyList(), eq("t1"), eq("u1"), any());

        MvcResult result = mockMvc.perform(post("/api/v1/chatbot/chat/stream")
                        .contentType(MediaType.APPLICATION_JSON).content(TURN))
                .andReturn();

        String body = result.getResponse().getContentAsString();
        assertThat(body).contains("\"content\":\"4\"");
        assertThat(body).contains("\"done\":true");
        assertThat(body.indexOf("\"content\":\"4\"")).isLessThan(body.indexOf("\"done\":true"));
    }

    @Test
    void getMessages_returnsHistory() throws Exception {
        when(agentLoop.getChatHistory("t1")).thenReturn(List.of(Message.user("hi"), Message.assistant("hello")));

        mockMvc.perform(get("/api/v1/chatbot/messages").param("threadId", "t1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.messages[0].role").value("user"))
                .andExpect(jsonPath("$.messages[1].content").value("hello"));
    }

    @Test
    void clearMessages_delegatesToLoop() throws Exception {
        mockMvc.perform(delete("/api/v1/chatbot/messages").param("threadId", "t1"))
                .andExpect(status().isOk());

        verify(agentLoop).clearChatHistory("t1");
    }

    @Test
    void health_isUp() throws Exception {
        mockMvc.perform(get("/api/v1/chatbot/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));
    }
}
