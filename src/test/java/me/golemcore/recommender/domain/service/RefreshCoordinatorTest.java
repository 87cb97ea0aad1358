package me.golemcore.recommender.domain.service;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RefreshCoordinatorTest {

    @Test
    void shouldReturnWorkResult() {
        RefreshCoordinator coordinator = new RefreshCoordinator();

        assertEquals("done", coordinator.runExclusive(1L, () -> "done"));
    }

    @Test
    void shouldReleaseLockWhenWorkFails() {
        RefreshCoordinator coordinator = new RefreshCoordinator();

        assertThrows(IllegalStateException.class, () -> coordinator.runExclusive(1L, () -> {
            throw new IllegalStateException("boom");
        }));
        assertEquals(2, coordinator.runExclusive(1L, () -> 2));
    }

    @Test
    void shouldSerializeWorkForSameUser() throws Exception {
        RefreshCoordinator coordinator = new RefreshCoordinator();
        ExecutorService executor = Executors.newFixedThreadPool(4);
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        try {
            Future<?>[] futures = new Future<?>[4];
            for (int i = 0; i < futures.length; i++) {
                futures[i] = executor.submit(() -> {
                    start.await();
                    return coordinator.runExclusive(7L, () -> {
                        int current = inFlight.incrementAndGet();
                        maxInFlight.accumulateAndGet(current, Math::max);
                        try {
                            Thread.sleep(20);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                        inFlight.decrementAndGet();
                        return current;
                    });
                });
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, maxInFlight.get());
    }

    @Test
    void shouldRunDifferentUsersConcurrently() throws Exception {
        RefreshCoordinator coordinator = new RefreshCoordinator();
        ExecutorService executor = Executors.newSingleThreadExecutor();
        CountDownLatch otherUserRan = new CountDownLatch(1);
        try {
            boolean completed = coordinator.runExclusive(1L, () -> {
                executor.submit(() -> coordinator.runExclusive(2L, () -> {
                    otherUserRan.countDown();
                    return null;
                }));
                try {
                    return otherUserRan.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return false;
                }
            });
            assertTrue(completed);
        } finally {
            executor.shutdownNow();
        }
    }

    // ==================== lock bookkeeping ====================

    @Test
    void shouldForgetUsersOnceTheirWorkFinishes() {
        RefreshCoordinator coordinator = new RefreshCoordinator();

        for (long user = 1; user <= 10_000; user++) {
            coordinator.runExclusive(user, () -> null);
        }

        assertEquals(0, coordinator.trackedUsers());
    }

    @Test
    void shouldTrackUserWhileWorkIsInFlight() {
        RefreshCoordinator coordinator = new RefreshCoordinator();

        int trackedInside = coordinator.runExclusive(3L,
                () -> coordinator.runExclusive(3L, coordinator::trackedUsers));

        assertEquals(1, trackedInside);
        assertEquals(0, coordinator.trackedUsers());
    }

    @Test
    void shouldForgetUserAfterFailedWork() {
        RefreshCoordinator coordinator = new RefreshCoordinator();

        assertThrows(IllegalStateException.class, () -> coordinator.runExclusive(4L, () -> {
            throw new IllegalStateException("boom");
        }));

        assertEquals(0, coordinator.trackedUsers());
    }

    @Test
    void shouldForgetUsersAfterContendedWork() throws Exception {
        RefreshCoordinator coordinator = new RefreshCoordinator();
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Future<?>[] futures = new Future<?>[64];
            for (int i = 0; i < futures.length; i++) {
                long user = i % 4;
                futures[i] = executor.submit(() -> {
                    start.await();
                    return coordinator.runExclusive(user, () -> user);
                });
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(5, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(0, coordinator.trackedUsers());
    }
}
