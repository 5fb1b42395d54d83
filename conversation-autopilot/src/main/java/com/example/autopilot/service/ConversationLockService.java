package com.example.autopilot.service;

import com.example.autopilot.service.exception.ConversationStoreException;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;
import org.redisson.client.RedisException;
import org.springframework.stereotype.Service;

/**
 * Per-conversation mutual exclusion across threads and nodes. Locks are reentrant, so a holder may
 * call back into code that locks the same conversation.
 */
@Service
@RequiredArgsConstructor
public class ConversationLockService {

    private final RedissonClient redissonClient;
    private final RedisKeyFactory keyFactory;

    public <T> T withLock(String conversationId, Supplier<T> action) {
        RLock lock = redissonClient.getLock(keyFactory.conversationLockKey(conversationId));
        try {
            lock.lock();
        } catch (RedisException ex) {
            throw new ConversationStoreException("Unable to lock conversation " + conversationId, ex);
        }
        try {
            return action.get();
        } finally {
            if (lock.isHeldByCurrentThread()) {
                lock.unlock();
            }
        }
    }

    public void withLock(String conversationId, Runnable action) {
        withLock(conversationId, () -> {
            action.run();
            return null;
        });
    }
}
