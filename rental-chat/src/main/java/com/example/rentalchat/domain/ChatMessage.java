package com.example.rentalchat.domain;

import java.io.Serializable;
import java.time.Instant;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A persisted chat message. Content is immutable once appended; {@code readBy} only grows.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatMessage implements Serializable {

    private String id;
    private long sequence;
    private String conversationId;
    private MessageType type;
    private String senderId;
    private String content;
    private Set<String> readBy;
    private Instant createdAt;
}
