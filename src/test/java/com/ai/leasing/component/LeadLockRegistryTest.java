package com.ai.leasing.component;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LeadLockRegistryTest {

    @Test
    void samePhoneAlwaysMapsToSameLock() {
        LeadLockRegistry registry = new LeadLockRegistry(16);

        assertThat(registry.lockFor("+972501234567")).isSameAs(registry.lockFor(" +972501234567 "));
    }

    @Test
    void workForOneLeadRunsOneAtATime() throws Exception {
        LeadLockRegistry registry = new LeadLockRegistry(8);
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    registry.withLead("+972501234567", () -> {
                        int now = inside.incrementAndGet();
                        maxInside.accumulateAndGet(now, Math::max);
                        try {
                            Thread.sleep(5);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                        inside.decrementAndGet();
                    });
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(maxInside.get()).isEqualTo(1);
    }

    @Test
    void lockIsReleasedWhenWorkThrows() {
        LeadLockRegistry registry = new LeadLockRegistry(4);

        assertThatThrownBy(() -> registry.withLead("+1", () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(registry.lockFor("+1").isLocked()).isFalse();
    }

    @Test
    void rejectsBlankPhoneAndBadStripeCount() {
        assertThatThrownBy(() -> new LeadLockRegistry(4).lockFor(" "))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new LeadLockRegistry(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
