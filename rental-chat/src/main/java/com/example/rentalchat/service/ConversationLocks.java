package com.example.rentalchat.service;

import java.util.function.Supplier;

/**
 * Short-lived exclusive sections keyed by an arbitrary string.
 */
public interface ConversationLocks {

    <T> T withLock(String key, Supplier<T> action);
}
