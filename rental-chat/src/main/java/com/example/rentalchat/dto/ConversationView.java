package com.example.rentalchat.dto;

import com.example.rentalchat.client.ListingSummary;
import com.example.rentalchat.client.UserSummary;
import com.example.rentalchat.domain.LastMessageSummary;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ConversationView {
    String id;
    List<UserSummary> participants;
    ListingSummary listing;
    LastMessageSummary lastMessage;
    long unreadCount;
    Instant createdAt;
    Instant updatedAt;
}
