package com.enterprise.approval.service;

import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import org.springframework.stereotype.Component;

import com.enterprise.approval.exception.ConcurrentModificationException;

import lombok.extern.slf4j.Slf4j;

/**
 * Per-request mutual exclusion within this process. A caller that finds the
 * lock taken fails immediately instead of waiting.
 */
@Component
@Slf4j
public class RequestLockRegistry {

    private final ConcurrentMap<UUID, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(UUID requestId, Supplier<T> action) {
        ReentrantLock lock = acquire(requestId);
        try {
            return action.get();
        } finally {
            release(requestId, lock);
        }
    }

    boolean isLocked(UUID requestId) {
        ReentrantLock lock = locks.get(requestId);
        return lock != null && lock.isLocked();
    }

    private ReentrantLock acquire(UUID requestId) {
        ReentrantLock lock = locks.computeIfAbsent(requestId, id -> new ReentrantLock());
        if (!lock.tryLock()) {
            log.warn("Request {} is already being modified", requestId);
            throw new ConcurrentModificationException("Request " + requestId + " is being modified by another action");
        }
        // the entry may have been removed by a releasing thread between computeIfAbsent and tryLock
        if (locks.get(requestId) != lock) {
            lock.unlock();
            throw new ConcurrentModificationException("Request " + requestId + " is being modified by another action");
        }
        return lock;
    }

    private void release(UUID requestId, ReentrantLock lock) {
        locks.remove(requestId, lock);
        lock.unlock();
    }
}
