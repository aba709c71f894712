package com.deepansh.graphagent.api;

import com.deepansh.graphagent.exception.AllBackendsExhaustedException;
import com.deepansh.graphagent.exception.CheckpointWriteException;
import com.deepansh.graphagent.graph.AgentLoop;
import com.deepansh.graphagent.model.ChatRequest;
import com.deepansh.graphagent.model.ChatResponse;
import com.deepansh.graphagent.model.StreamChunk;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.Map;

/**
 * Chat endpoints. Thread and user ids come from the request; there is no auth layer.
 *
 * POST   /api/v1/chatbot/chat
 * POST   /api/v1/chatbot/chat/stream   text/event-stream of {content, done}
 * GET    /api/v1/chatbot/messages?threadId=
 * DELETE /api/v1/chatbot/messages?threadId=
 * GET    /api/v1/chatbot/health
 */
@RestController
@RequestMapping("/api/v1/chatbot")
@Slf4j
public class ChatController {

    private static final long STREAM_TIMEOUT_MS = 10 * 60 * 1000;

    private final AgentLoop agentLoop;
    private final TaskExecutor streamTaskExecutor;

    public ChatController(AgentLoop agentLoop,
                          @Qualifier("streamTaskExecutor") TaskExecutor streamTaskExecutor) {
        this.agentLoop = agentLoop;
        this.streamTaskExecutor = streamTaskExecutor;
    }

    @PostMapping("/chat")
    public ResponseEntity<ChatResponse> chat(@Valid @RequestBody ChatRequest request) {
        log.info("Chat request [threadId={}, userId={}, messages={}]",
                request.getThreadId(), request.getUserId(), request.getMessages().size());
        return ResponseEntity.ok(ChatResponse.of(
                agentLoop.getResponse(request.toMessages(), request.getThreadId(), request.getUserId())));
    }

    @PostMapping(value = "/chat/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter chatStream(@Valid @RequestBody ChatRequest request) {
        log.info("Stream request [threadId={}, userId={}, messages={}]",
                request.getThreadId(), request.getUserId(), request.getMessages().size());

        SseEmitter emitter = new SseEmitter(STREAM_TIMEOUT_MS);
        emitter.onTimeout(() -> log.warn("Stream timed out [threadId={}]", request.getThreadId()));

        streamTaskExecutor.execute(() -> {
            try {
                agentLoop.streamResponse(request.toMessages(), request.getThreadId(), request.getUserId(),
                        chunk -> send(emitter, chunk));
                emitter.complete();
            } catch (Exception e) {
                log.error("Streamed turn failed [threadId={}]", request.getThreadId(), e);
                sendError(emitter, e);
            }
        });
        return emitter;
    }

    @GetMapping("/messages")
    public ResponseEntity<ChatResponse> getMessages(@RequestParam String threadId) {
        return ResponseEntity.ok(ChatResponse.of(agentLoop.getChatHistory(threadId)));
    }

    @DeleteMapping("/messages")
    public ResponseEntity<Map<String, String>> clearMessages(@RequestParam String threadId) {
        agentLoop.clearChatHistory(threadId);
        return ResponseEntity.ok(Map.of("message", "Chat history cleared", "threadId", threadId));
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        return ResponseEntity.ok(Map.of("status", "UP"));
    }

    private void send(SseEmitter emitter, StreamChunk chunk) {
        try {
            emitter.send(SseEmitter.event().data(chunk, MediaType.APPLICATION_JSON));
        } catch (IOException e) {
            throw new IllegalStateException("Client disconnected from stream", e);
        }
    }

    /** Errors end the stream with an "error" event instead of completeWithError. */
    private void sendError(SseEmitter emitter, Exception e) {
        String code = e instanceof AllBackendsExhaustedException ? "BACKENDS_EXHAUSTED"
                : e instanceof CheckpointWriteException ? "STATE_NOT_PERSISTED"
                : "INTERNAL_ERROR";
        try {
            emitter.send(SseEmitter.event().name("error")
                    .data(Map.of("error", "The turn could not be completed", "code", code),
                            MediaType.APPLICATION_JSON));
            emitter.complete();
        } catch (IOException | IllegalStateException sendFailure) {
            log.debug("Could not deliver stream error event: {}", sendFailure.getMessage());
            emitter.completeWithError(e);
        }
    }
}
