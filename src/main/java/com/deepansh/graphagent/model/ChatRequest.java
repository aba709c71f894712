package com.deepansh.graphagent.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.List;

@Data
public class ChatRequest {

    @NotEmpty(message = "messages must not be empty")
    private List<@Valid ChatMessage> messages;

    /** Scopes the persisted conversation; the same id resumes the same transcript. */
    @NotBlank(message = "threadId must not be blank")
    private String threadId;

    /** Scopes long-term memory lookups and writes. */
    @NotBlank(message = "userId must not be blank")
    private String userId;

    public List<Message> toMessages() {
        return messages.stream().map(ChatMessage::toMessage).toList();
    }
}
