package com.deepansh.graphagent.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChatResponse {

    private List<ChatMessage> messages;

    public static ChatResponse of(List<Message> messages) {
        return new ChatResponse(messages.stream().map(ChatMessage::from).toList());
    }
}
