package com.deepansh.graphagent.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A single inbound message as clients send it. Tool messages are internal
 * to the graph and cannot be submitted.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChatMessage {

    @NotBlank(message = "role must not be blank")
    @Pattern(regexp = "user|assistant|system", message = "role must be one of user, assistant, system")
    private String role;

    @NotBlank(message = "content must not be blank")
    @Size(min = 1, max = 3000, message = "content must be between 1 and 3000 characters")
    private String content;

    public Message toMessage() {
        return Message.builder()
                .role(Message.Role.valueOf(role))
                .content(content)
                .build();
    }

    public static ChatMessage from(Message message) {
        return new ChatMessage(message.getRole().name(), message.getContent());
    }
}
