package com.example.rentalchat.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class StartConversationRequest {

    @NotBlank
    private String recipientId;

    /**
     * Listing the conversation is about. Separate conversations exist per listing.
     */
    private String listingId;
}
