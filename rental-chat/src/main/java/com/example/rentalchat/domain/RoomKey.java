package com.example.rentalchat.domain;

/**
 * Live delivery grouping key. Conversation rooms and personal notification rooms share one namespace,
 * so the kind is part of the key.
 */
public record RoomKey(Kind kind, String id) {

    public enum Kind {
        CONVERSATION,
        USER
    }

    public RoomKey {
        if (kind == null || id == null || id.isBlank()) {
            throw new IllegalArgumentException("Room kind and id are required");
        }
    }

    public static RoomKey conversation(String conversationId) {
        return new RoomKey(Kind.CONVERSATION, conversationId);
    }

    public static RoomKey user(String userId) {
        return new RoomKey(Kind.USER, userId);
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase() + ":" + id;
    }
}
