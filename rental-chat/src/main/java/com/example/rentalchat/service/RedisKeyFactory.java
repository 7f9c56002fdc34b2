package com.example.rentalchat.service;

import com.example.rentalchat.config.ChatProperties;
import org.springframework.stereotype.Component;

@Component
public class RedisKeyFactory {

    private final ChatProperties chatProperties;

    public RedisKeyFactory(ChatProperties chatProperties) {
        this.chatProperties = chatProperties;
    }

    private String prefix() {
        return chatProperties.getRedis().getKeyPrefix();
    }

    public String conversationLockKey(String conversationId) {
        return "%s:conversation:%s:lock".formatted(prefix(), conversationId);
    }

    public String creationLockKey(String participantKey, String scopeKey) {
        return "%s:conversation-create:%s|%s:lock".formatted(prefix(), participantKey, scopeKey);
    }
}
