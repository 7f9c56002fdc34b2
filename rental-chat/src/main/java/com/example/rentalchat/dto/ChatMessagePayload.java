package com.example.rentalchat.dto;

import lombok.Data;

/**
 * Inbound {@code send-message} socket payload.
 */
@Data
public class ChatMessagePayload {

    private String conversationId;

    private String content;
}
