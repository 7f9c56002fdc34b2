package com.example.rentalchat.event;

public enum ChatEventType {
    CONVERSATION_STARTED,
    MESSAGE_CREATED,
    MESSAGES_READ
}
