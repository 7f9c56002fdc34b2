package com.example.rentalchat.domain;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Conversation implements Serializable {

    private String id;
    private List<String> participants;
    private String scopeRef;
    private LastMessageSummary lastMessage;
    private Instant createdAt;
    private Instant updatedAt;

    public boolean hasParticipant(String userId) {
        return userId != null && participants != null && participants.contains(userId);
    }
}
