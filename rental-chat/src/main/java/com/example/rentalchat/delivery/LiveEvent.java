package com.example.rentalchat.delivery;

import com.example.rentalchat.domain.ChatMessage;
import com.example.rentalchat.domain.LastMessageSummary;
import com.example.rentalchat.domain.RoomKey;
import java.util.Map;

/**
 * Fire-and-forget signal routed to connected sessions. Never persisted.
 */
public record LiveEvent(LiveEventType type, Object payload) {

    public static LiveEvent messageCreated(ChatMessage message) {
        return new LiveEvent(LiveEventType.MESSAGE_CREATED, message);
    }

    public static LiveEvent typingStart(RoomKey roomKey, String userId) {
        return new LiveEvent(LiveEventType.TYPING_START, typingPayload(roomKey, userId));
    }

    public static LiveEvent typingStop(RoomKey roomKey, String userId) {
        return new LiveEvent(LiveEventType.TYPING_STOP, typingPayload(roomKey, userId));
    }

    public static LiveEvent messagesRead(String conversationId, String userId, int count) {
        return new LiveEvent(LiveEventType.MESSAGES_READ, Map.of(
                "conversationId", conversationId,
                "userId", userId,
                "count", count));
    }

    public static LiveEvent conversationUpdated(String conversationId, LastMessageSummary lastMessage) {
        return new LiveEvent(LiveEventType.CONVERSATION_UPDATED, Map.of(
                "conversationId", conversationId,
                "lastMessage", lastMessage));
    }

    public String name() {
        return type.getEventName();
    }

    private static Map<String, Object> typingPayload(RoomKey roomKey, String userId) {
        return Map.of(
                "roomKey", roomKey.toString(),
                "conversationId", roomKey.id(),
                "userId", userId);
    }
}
