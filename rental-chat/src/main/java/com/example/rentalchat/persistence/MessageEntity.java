package com.example.rentalchat.persistence;

import com.example.rentalchat.domain.MessageType;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Entity
@Table(
        name = "chat_messages",
        indexes = @Index(name = "idx_chat_messages_conversation_seq", columnList = "conversation_id, seq_no"))
public class MessageEntity {

    /**
     * Store-assigned, strictly increasing. Total order of messages within a conversation.
     */
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "seq_no", nullable = false, updatable = false)
    private Long sequence;

    @Column(name = "message_id", nullable = false, updatable = false, unique = true, length = 64)
    private String messageId;

    @Column(name = "conversation_id", nullable = false, updatable = false, length = 64)
    private String conversationId;

    @Column(name = "sender_id", nullable = false, updatable = false, length = 128)
    private String senderId;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, updatable = false, length = 16)
    private MessageType type;

    @Column(name = "content", nullable = false, updatable = false, length = 4000)
    private String content;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "chat_message_reads", joinColumns = @JoinColumn(name = "message_seq_no"))
    @Column(name = "user_id", nullable = false, length = 128)
    private Set<String> readBy = new HashSet<>();
}
