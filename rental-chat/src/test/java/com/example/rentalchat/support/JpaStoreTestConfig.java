package com.example.rentalchat.support;

import com.example.rentalchat.config.ChatProperties;
import com.example.rentalchat.persistence.ConversationEntityMapper;
import com.example.rentalchat.persistence.JpaConversationDirectory;
import com.example.rentalchat.persistence.JpaMessageStore;
import com.example.rentalchat.service.ConversationLocks;
import com.example.rentalchat.service.RedisKeyFactory;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

/**
 * Wires the JPA stores for {@code @DataJpaTest} slices, with process-local locks in place of Redisson.
 */
@TestConfiguration
@Import({JpaMessageStore.class, JpaConversationDirectory.class, ConversationEntityMapper.class})
public class JpaStoreTestConfig {

    @Bean
    public ChatProperties chatProperties() {
        ChatProperties properties = new ChatProperties();
        properties.getMessages().setMaxLength(50);
        return properties;
    }

    @Bean
    public RedisKeyFactory redisKeyFactory(ChatProperties chatProperties) {
        return new RedisKeyFactory(chatProperties);
    }

    @Bean
    public ConversationLocks conversationLocks() {
        return new LocalConversationLocks();
    }
}
