package com.example.rentalchat.persistence;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import jakarta.persistence.Version;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Entity
@Table(
        name = "chat_conversations",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_chat_conversations_participants_scope",
                columnNames = {"participant_key", "scope_key"}))
public class ConversationEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 64)
    private String id;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(
            name = "chat_conversation_participants",
            joinColumns = @JoinColumn(name = "conversation_id"),
            indexes = @Index(name = "idx_chat_participants_user", columnList = "user_id"))
    @OrderColumn(name = "participant_order")
    @Column(name = "user_id", nullable = false, length = 128)
    private List<String> participants = new ArrayList<>();

    @Column(name = "participant_key", nullable = false, updatable = false, length = 1024)
    private String participantKey;

    @Column(name = "scope_key", nullable = false, updatable = false, length = 128)
    private String scopeKey;

    @Column(name = "scope_ref", length = 128)
    private String scopeRef;

    @Column(name = "last_message_content", length = 4000)
    private String lastMessageContent;

    @Column(name = "last_message_sender_id", length = 128)
    private String lastMessageSenderId;

    @Column(name = "last_message_at")
    private Instant lastMessageAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Version
    @Column(name = "version")
    private Long version;
}
