package com.example.rentalchat.delivery;

public enum LiveEventType {
    MESSAGE_CREATED("message-created"),
    TYPING_START("typing-start"),
    TYPING_STOP("typing-stop"),
    MESSAGES_READ("messages-read"),
    CONVERSATION_UPDATED("conversation-updated");

    private final String eventName;

    LiveEventType(String eventName) {
        this.eventName = eventName;
    }

    /**
     * Name the event is emitted under on the wire.
     */
    public String getEventName() {
        return eventName;
    }
}
