package com.example.rentalchat.domain;

import java.io.Serializable;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LastMessageSummary implements Serializable {

    private String content;
    private String senderId;
    private Instant sentAt;

    public static LastMessageSummary of(ChatMessage message) {
        return new LastMessageSummary(message.getContent(), message.getSenderId(), message.getCreatedAt());
    }
}
