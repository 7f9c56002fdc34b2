package com.example.rentalchat.client;

import com.example.rentalchat.config.ChatProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Looks up display data for participants from the account service. Best effort: any failure yields an
 * id-only summary so conversation reads never fail because of the account service.
 */
@Slf4j
@Component
public class UserDirectoryClient {

    private final RestClient rest;

    public UserDirectoryClient(ChatProperties chatProperties) {
        ChatProperties.Collaborators collaborators = chatProperties.getCollaborators();
        this.rest = CollaboratorRestClients.create(collaborators.getUsersUrl(), collaborators.getTimeout());
    }

    public UserSummary findUser(String userId) {
        if (rest == null) {
            return UserSummary.idOnly(userId);
        }
        try {
            UserSummary user = rest.get()
                    .uri("/{id}", userId)
                    .retrieve()
                    .body(UserSummary.class);
            return user != null ? user : UserSummary.idOnly(userId);
        } catch (RestClientException ex) {
            log.warn("User lookup failed for {}: {}", userId, ex.getMessage());
            return UserSummary.idOnly(userId);
        }
    }
}
