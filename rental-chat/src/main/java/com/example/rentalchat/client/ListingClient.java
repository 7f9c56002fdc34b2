package com.example.rentalchat.client;

import com.example.rentalchat.config.ChatProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Title, location and price of the listing a conversation is about. Same best-effort contract as
 * {@link UserDirectoryClient}.
 */
@Slf4j
@Component
public class ListingClient {

    private final RestClient rest;

    public ListingClient(ChatProperties chatProperties) {
        ChatProperties.Collaborators collaborators = chatProperties.getCollaborators();
        this.rest = CollaboratorRestClients.create(collaborators.getListingsUrl(), collaborators.getTimeout());
    }

    public ListingSummary findListing(String listingId) {
        if (rest == null) {
            return ListingSummary.idOnly(listingId);
        }
        try {
            ListingSummary listing = rest.get()
                    .uri("/{id}", listingId)
                    .retrieve()
                    .body(ListingSummary.class);
            return listing != null ? listing : ListingSummary.idOnly(listingId);
        } catch (RestClientException ex) {
            log.warn("Listing lookup failed for {}: {}", listingId, ex.getMessage());
            return ListingSummary.idOnly(listingId);
        }
    }
}
