package com.example.rentalchat.service;

import com.example.rentalchat.client.ListingClient;
import com.example.rentalchat.client.ListingSummary;
import com.example.rentalchat.client.UserDirectoryClient;
import com.example.rentalchat.client.UserSummary;
import com.example.rentalchat.domain.Conversation;
import com.example.rentalchat.dto.ConversationView;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToLongFunction;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Read-side composition: decorates stored conversations with participant and listing summaries fetched
 * from their owning services. The stores only ever hold references.
 */
@Component
@RequiredArgsConstructor
public class ConversationViewAssembler {

    private final UserDirectoryClient userDirectoryClient;
    private final ListingClient listingClient;

    public ConversationView assemble(Conversation conversation, long unreadCount) {
        return assemble(conversation, unreadCount, new HashMap<>(), new HashMap<>());
    }

    /**
     * Assembles a page of conversations, fetching each distinct user and listing once.
     */
    public List<ConversationView> assembleAll(
            List<Conversation> conversations, ToLongFunction<Conversation> unreadCount) {
        Map<String, UserSummary> users = new HashMap<>();
        Map<String, ListingSummary> listings = new HashMap<>();
        return conversations.stream()
                .map(conversation -> assemble(
                        conversation, unreadCount.applyAsLong(conversation), users, listings))
                .toList();
    }

    private ConversationView assemble(
            Conversation conversation,
            long unreadCount,
            Map<String, UserSummary> users,
            Map<String, ListingSummary> listings) {
        List<UserSummary> participants = conversation.getParticipants().stream()
                .map(id -> users.computeIfAbsent(id, userDirectoryClient::findUser))
                .toList();
        ListingSummary listing = conversation.getScopeRef() == null
                ? null
                : listings.computeIfAbsent(conversation.getScopeRef(), listingClient::findListing);
        return ConversationView.builder()
                .id(conversation.getId())
                .participants(participants)
                .listing(listing)
                .lastMessage(conversation.getLastMessage())
                .unreadCount(unreadCount)
                .createdAt(conversation.getCreatedAt())
                .updatedAt(conversation.getUpdatedAt())
                .build();
    }
}
