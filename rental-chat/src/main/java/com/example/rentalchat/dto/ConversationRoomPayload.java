package com.example.rentalchat.dto;

import lombok.Data;

/**
 * Inbound {@code join}, {@code leave}, {@code typing-start} and {@code typing-stop} socket payload.
 */
@Data
public class ConversationRoomPayload {

    private String conversationId;
}
