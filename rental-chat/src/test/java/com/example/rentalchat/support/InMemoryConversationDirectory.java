package com.example.rentalchat.support;

import com.example.rentalchat.domain.Conversation;
import com.example.rentalchat.domain.LastMessageSummary;
import com.example.rentalchat.service.ConversationDirectory;
import com.example.rentalchat.service.exception.NotFoundException;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

public class InMemoryConversationDirectory implements ConversationDirectory {

    private final Map<String, Conversation> byId = new LinkedHashMap<>();
    private final Map<String, String> idsByKey = new LinkedHashMap<>();

    @Override
    public synchronized FindOrCreateResult findOrCreate(List<String> participantIds, String scopeRef) {
        String key = ConversationDirectory.participantKey(participantIds) + "|" + ConversationDirectory.scopeKey(scopeRef);
        String existingId = idsByKey.get(key);
        if (existingId != null) {
            return new FindOrCreateResult(copy(byId.get(existingId)), false);
        }
        Instant now = Instant.now();
        Conversation conversation = Conversation.builder()
                .id(UUID.randomUUID().toString())
                .participants(List.copyOf(participantIds))
                .scopeRef(scopeRef)
                .createdAt(now)
                .updatedAt(now)
                .build();
        byId.put(conversation.getId(), conversation);
        idsByKey.put(key, conversation.getId());
        return new FindOrCreateResult(copy(conversation), true);
    }

    @Override
    public synchronized Optional<Conversation> findById(String conversationId) {
        return Optional.ofNullable(byId.get(conversationId)).map(this::copy);
    }

    @Override
    public synchronized List<Conversation> listForUser(String userId, int limit) {
        return byId.values().stream()
                .filter(conversation -> conversation.hasParticipant(userId))
                .sorted(Comparator.comparing(this::activity).reversed())
                .limit(limit)
                .map(this::copy)
                .toList();
    }

    @Override
    public synchronized void updateLastMessage(String conversationId, LastMessageSummary summary) {
        Conversation conversation = byId.get(conversationId);
        if (conversation == null) {
            throw new NotFoundException("Conversation not found");
        }
        conversation.setLastMessage(summary);
        conversation.setUpdatedAt(Instant.now());
    }

    public synchronized int size() {
        return byId.size();
    }

    private Instant activity(Conversation conversation) {
        return conversation.getLastMessage() != null
                ? conversation.getLastMessage().getSentAt()
                : conversation.getCreatedAt();
    }

    private Conversation copy(Conversation conversation) {
        return Conversation.builder()
                .id(conversation.getId())
                .participants(conversation.getParticipants())
                .scopeRef(conversation.getScopeRef())
                .lastMessage(conversation.getLastMessage())
                .createdAt(conversation.getCreatedAt())
                .updatedAt(conversation.getUpdatedAt())
                .build();
    }
}
