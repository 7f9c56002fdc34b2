package com.example.rentalchat.config;

import org.redisson.Redisson;
import org.redisson.api.RedissonClient;
import org.redisson.config.Config;
import org.redisson.config.SingleServerConfig;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.data.redis.RedisProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

/**
 * Redisson client backing the conversation locks. Connection settings come from {@code spring.data.redis.*};
 * the pool stays small because the client only ever takes and releases locks.
 */
@Configuration
public class RedissonConfig {

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnMissingBean
    public RedissonClient redissonClient(RedisProperties redisProperties, ChatProperties chatProperties) {
        Config config = new Config();
        SingleServerConfig server = config.useSingleServer()
                .setAddress(address(redisProperties))
                .setDatabase(redisProperties.getDatabase())
                .setClientName(chatProperties.getRedis().getKeyPrefix())
                .setConnectionMinimumIdleSize(2)
                .setConnectionPoolSize(16);
        if (StringUtils.hasText(redisProperties.getUsername())) {
            server.setUsername(redisProperties.getUsername());
        }
        if (StringUtils.hasText(redisProperties.getPassword())) {
            server.setPassword(redisProperties.getPassword());
        }
        if (redisProperties.getTimeout() != null) {
            server.setTimeout((int) redisProperties.getTimeout().toMillis());
        }
        return Redisson.create(config);
    }

    private String address(RedisProperties redisProperties) {
        boolean ssl = redisProperties.getSsl() != null && redisProperties.getSsl().isEnabled();
        return "%s://%s:%d".formatted(ssl ? "rediss" : "redis", redisProperties.getHost(), redisProperties.getPort());
    }
}
