package com.example.rentalchat.support;

import com.example.rentalchat.domain.ChatMessage;
import com.example.rentalchat.domain.MessageType;
import com.example.rentalchat.service.MessageStore;
import com.example.rentalchat.service.exception.ValidationException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.springframework.util.StringUtils;

public class InMemoryMessageStore implements MessageStore {

    private final List<ChatMessage> messages = new ArrayList<>();
    private long nextSequence = 1;

    @Override
    public synchronized ChatMessage append(String conversationId, String senderId, MessageType type, String content) {
        if (!StringUtils.hasText(content)) {
            throw new ValidationException("Message content must not be empty");
        }
        Set<String> readBy = new HashSet<>();
        readBy.add(senderId);
        ChatMessage message = ChatMessage.builder()
                .id(UUID.randomUUID().toString())
                .sequence(nextSequence++)
                .conversationId(conversationId)
                .type(type)
                .senderId(senderId)
                .content(content)
                .readBy(readBy)
                .createdAt(Instant.now())
                .build();
        messages.add(message);
        return copy(message);
    }

    @Override
    public synchronized List<ChatMessage> listByConversation(String conversationId, Long afterSequence, int limit) {
        List<ChatMessage> matching = messages.stream()
                .filter(message -> message.getConversationId().equals(conversationId))
                .filter(message -> afterSequence == null || message.getSequence() > afterSequence)
                .map(this::copy)
                .toList();
        if (afterSequence != null) {
            return matching.stream().limit(limit).toList();
        }
        return matching.subList(Math.max(0, matching.size() - limit), matching.size());
    }

    @Override
    public synchronized int markRead(String conversationId, String userId) {
        int marked = 0;
        for (ChatMessage message : messages) {
            if (counts(message, conversationId, userId) && message.getReadBy().add(userId)) {
                marked++;
            }
        }
        return marked;
    }

    @Override
    public synchronized long unreadCount(String conversationId, String userId) {
        return messages.stream()
                .filter(message -> counts(message, conversationId, userId))
                .filter(message -> !message.getReadBy().contains(userId))
                .count();
    }

    private boolean counts(ChatMessage message, String conversationId, String userId) {
        return message.getConversationId().equals(conversationId)
                && message.getType() != MessageType.SYSTEM
                && !message.getSenderId().equals(userId);
    }

    private ChatMessage copy(ChatMessage message) {
        return ChatMessage.builder()
                .id(message.getId())
                .sequence(message.getSequence())
                .conversationId(message.getConversationId())
                .type(message.getType())
                .senderId(message.getSenderId())
                .content(message.getContent())
                .readBy(Set.copyOf(message.getReadBy()))
                .createdAt(message.getCreatedAt())
                .build();
    }
}
