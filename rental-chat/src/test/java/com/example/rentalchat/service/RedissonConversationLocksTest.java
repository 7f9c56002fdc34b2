package com.example.rentalchat.service;

import com.example.rentalchat.config.ChatProperties;
import com.example.rentalchat.service.exception.TransientStoreException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedissonConversationLocksTest {

    private static final String KEY = "rental-chat:conversation:conv-1:lock";

    @Mock
    private RedissonClient redissonClient;

    @Mock
    private RLock lock;

    private RedissonConversationLocks locks;

    @BeforeEach
    void setUp() {
        locks = new RedissonConversationLocks(redissonClient, new ChatProperties());
    }

    private void givenLockAcquired(boolean acquired) throws InterruptedException {
        when(redissonClient.getLock(KEY)).thenReturn(lock);
        when(lock.tryLock(5000, 30000, TimeUnit.MILLISECONDS)).thenReturn(acquired);
    }

    @Test
    void withLock_shouldRunActionAndRelease() throws Exception {
        givenLockAcquired(true);
        when(lock.isHeldByCurrentThread()).thenReturn(true);

        String result = locks.withLock(KEY, () -> "done");

        assertThat(result).isEqualTo("done");
        verify(lock).unlock();
    }

    @Test
    void withLock_shouldReleaseWhenActionFails() throws Exception {
        givenLockAcquired(true);
        when(lock.isHeldByCurrentThread()).thenReturn(true);

        assertThrows(IllegalStateException.class, () -> locks.withLock(KEY, () -> {
            throw new IllegalStateException("append failed");
        }));
        verify(lock).unlock();
    }

    @Test
    void withLock_timeoutShouldBeTransient() throws Exception {
        givenLockAcquired(false);

        TransientStoreException ex = assertThrows(TransientStoreException.class, () -> locks.withLock(KEY, () -> "never"));

        assertThat(ex.isRetryable()).isTrue();
        verify(lock, never()).unlock();
    }

    @Test
    void redisKeyFactory_shouldNamespaceKeys() {
        RedisKeyFactory keyFactory = new RedisKeyFactory(new ChatProperties());

        assertThat(keyFactory.conversationLockKey("conv-1")).isEqualTo(KEY);
        assertThat(keyFactory.creationLockKey("a,b", "listing-1"))
                .isEqualTo("rental-chat:conversation-create:a,b|listing-1:lock");
    }
}
