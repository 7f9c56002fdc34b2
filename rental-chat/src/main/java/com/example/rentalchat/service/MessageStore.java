package com.example.rentalchat.service;

import com.example.rentalchat.domain.ChatMessage;
import com.example.rentalchat.domain.MessageType;
import java.util.List;

/**
 * Durable, append-only record of chat messages per conversation, including per-message read state.
 */
public interface MessageStore {

    /**
     * Persists a new message. The sender is recorded as having read it.
     *
     * @throws com.example.rentalchat.service.exception.ValidationException if content is blank or too long
     */
    ChatMessage append(String conversationId, String senderId, MessageType type, String content);

    /**
     * Messages oldest first. Without a cursor the most recent {@code limit} messages are returned;
     * with {@code afterSequence} the first {@code limit} messages newer than that sequence.
     */
    List<ChatMessage> listByConversation(String conversationId, Long afterSequence, int limit);

    /**
     * Adds {@code userId} to the read set of every text message in the conversation not sent by that user.
     * System messages are never unread.
     *
     * @return number of messages newly marked; 0 when everything was already read
     */
    int markRead(String conversationId, String userId);

    long unreadCount(String conversationId, String userId);
}
