package com.example.rentalchat.event;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import lombok.Builder;
import lombok.Value;

/**
 * Integration event published to the lifecycle topic once a conversation change is durable.
 */
@Value
@Builder
public class ChatEvent {

    String eventId;
    ChatEventType type;
    String conversationId;
    Instant occurredAt;
    Map<String, Object> payload;

    public static ChatEvent of(ChatEventType type, String conversationId, Map<String, Object> payload) {
        return ChatEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .type(type)
                .conversationId(conversationId)
                .occurredAt(Instant.now())
                .payload(payload == null ? Map.of() : Map.copyOf(payload))
                .build();
    }
}
