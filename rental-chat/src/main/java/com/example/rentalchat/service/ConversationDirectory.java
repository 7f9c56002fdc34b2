package com.example.rentalchat.service;

import com.example.rentalchat.domain.Conversation;
import com.example.rentalchat.domain.LastMessageSummary;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface ConversationDirectory {

    /**
     * Returns the conversation for this participant set and scope, creating it when absent. Concurrent
     * callers with the same key converge on one conversation.
     */
    FindOrCreateResult findOrCreate(List<String> participantIds, String scopeRef);

    Optional<Conversation> findById(String conversationId);

    /**
     * Conversations the user takes part in, most recently active first.
     */
    List<Conversation> listForUser(String userId, int limit);

    /**
     * Overwrites the denormalized summary. Last writer wins.
     */
    void updateLastMessage(String conversationId, LastMessageSummary summary);

    record FindOrCreateResult(Conversation conversation, boolean created) {}

    /**
     * Order-insensitive lookup key for a participant set.
     */
    static String participantKey(Collection<String> participantIds) {
        return String.join(",", participantIds.stream().distinct().sorted().toList());
    }

    static String scopeKey(String scopeRef) {
        return scopeRef == null ? "" : scopeRef;
    }
}
