package com.example.rentalchat.service;

import com.example.rentalchat.service.exception.UnauthenticatedException;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Resolves the caller's user id as supplied by the upstream auth gateway. The id is trusted as-is; only
 * its presence is checked.
 */
@Component
public class ParticipantIdentityService {

    public String resolveUserId(String... candidates) {
        if (candidates != null) {
            for (String candidate : candidates) {
                if (StringUtils.hasText(candidate)) {
                    return candidate.trim();
                }
            }
        }
        throw new UnauthenticatedException("Authenticated user id is required");
    }
}
