package org.example.coach.service;

import org.example.coach.entity.LeaderboardPeriod;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LeaderboardLocksTest {

    private final LeaderboardLocks locks = new LeaderboardLocks();

    @Test
    void withLocks_holdsRequestedPeriodsOnlyDuringWork() {
        boolean heldInside = locks.withLocks(EnumSet.of(LeaderboardPeriod.WEEKLY),
                () -> locks.isHeld(LeaderboardPeriod.WEEKLY) && !locks.isHeld(LeaderboardPeriod.MONTHLY));

        assertTrue(heldInside);
        assertFalse(locks.isHeld(LeaderboardPeriod.WEEKLY));
    }

    @Test
    void runWithLocks_failingWork_stillReleases() {
        assertThrows(IllegalStateException.class, () -> locks.runWithLocks(
                EnumSet.allOf(LeaderboardPeriod.class),
                () -> {
                    throw new IllegalStateException("boom");
                }));

        for (LeaderboardPeriod period : LeaderboardPeriod.values()) {
            assertFalse(locks.isHeld(period));
        }
    }

    @Test
    void withLocks_concurrentWriters_areSerialized() throws Exception {
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                List<LeaderboardPeriod> periods = i % 2 == 0
                        ? List.of(LeaderboardPeriod.MONTHLY, LeaderboardPeriod.ALL_TIME)
                        : List.of(LeaderboardPeriod.ALL_TIME, LeaderboardPeriod.WEEKLY);
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int round = 0; round < 50; round++) {
                        locks.runWithLocks(periods, () -> {
                            maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                            inside.decrementAndGet();
                        });
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, maxInside.get());
    }
}
