package com.enterprise.approval.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import com.enterprise.approval.exception.ConcurrentModificationException;

class RequestLockRegistryTest {

    private final RequestLockRegistry registry = new RequestLockRegistry();
    private final ExecutorService executor = Executors.newSingleThreadExecutor();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void secondCallerFailsFastWhileLockIsHeld() throws Exception {
        UUID requestId = UUID.randomUUID();
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        Future<String> holder = executor.submit(() -> registry.withLock(requestId, () -> {
            held.countDown();
            await(release);
            return "first";
        }));
        assertThat(held.await(5, TimeUnit.SECONDS)).isTrue();

        assertThatThrownBy(() -> registry.withLock(requestId, () -> "second"))
                .isInstanceOf(ConcurrentModificationException.class);

        release.countDown();
        assertThat(holder.get(5, TimeUnit.SECONDS)).isEqualTo("first");
        assertThat(registry.withLock(requestId, () -> "third")).isEqualTo("third");
        assertThat(registry.isLocked(requestId)).isFalse();
    }

    @Test
    void distinctRequestsDoNotContend() throws Exception {
        UUID first = UUID.randomUUID();
        UUID second = UUID.randomUUID();
        CountDownLatch held = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        Future<String> holder = executor.submit(() -> registry.withLock(first, () -> {
            held.countDown();
            await(release);
            return "first";
        }));
        assertThat(held.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(registry.withLock(second, () -> "second")).isEqualTo("second");

        release.countDown();
        holder.get(5, TimeUnit.SECONDS);
    }

    @Test
    void lockIsReleasedWhenActionThrows() {
        UUID requestId = UUID.randomUUID();

        assertThatThrownBy(() -> registry.withLock(requestId, () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(registry.isLocked(requestId)).isFalse();
        assertThat(registry.withLock(requestId, () -> "ok")).isEqualTo("ok");
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
