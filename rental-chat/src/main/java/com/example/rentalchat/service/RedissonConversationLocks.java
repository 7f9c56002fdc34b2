package com.example.rentalchat.service;

import com.example.rentalchat.config.ChatProperties;
import com.example.rentalchat.service.exception.TransientStoreException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RedissonConversationLocks implements ConversationLocks {

    private final RedissonClient redissonClient;
    private final ChatProperties chatProperties;

    @Override
    public <T> T withLock(String key, Supplier<T> action) {
        RLock lock = redissonClient.getLock(key);
        ChatProperties.Locks locks = chatProperties.getLocks();
        boolean acquired;
        try {
            acquired = lock.tryLock(
                    locks.getWaitTime().toMillis(), locks.getLeaseTime().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientStoreException("Interrupted while waiting for lock " + key, e);
        }
        if (!acquired) {
            throw new TransientStoreException("Timed out waiting for lock " + key, null);
        }
        try {
            return action.get();
        } finally {
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
            }
        }
    }
}
