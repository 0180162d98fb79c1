package org.example.coach.service;

import org.example.coach.entity.LeaderboardPeriod;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per leaderboard period, shared by live score updates and scheduled resets.
 * <p>
 * Locks are taken in period declaration order. Inside a transaction they are held until
 * the transaction completes so a rank recompute is never observed half-written.
 */
@Component
public class LeaderboardLocks {

    private final Map<LeaderboardPeriod, ReentrantLock> locks = new EnumMap<>(LeaderboardPeriod.class);

    public LeaderboardLocks() {
        for (LeaderboardPeriod period : LeaderboardPeriod.values()) {
            locks.put(period, new ReentrantLock());
        }
    }

    public <T> T withLocks(Collection<LeaderboardPeriod> periods, Supplier<T> work) {
        List<ReentrantLock> acquired = acquire(periods);
        boolean deferred = releaseAfterTransaction(acquired);
        try {
            return work.get();
        } finally {
            if (!deferred) {
                release(acquired);
            }
        }
    }

    public void runWithLocks(Collection<LeaderboardPeriod> periods, Runnable work) {
        withLocks(periods, () -> {
            work.run();
            return null;
        });
    }

    boolean isHeld(LeaderboardPeriod period) {
        return locks.get(period).isHeldByCurrentThread();
    }

    private List<ReentrantLock> acquire(Collection<LeaderboardPeriod> periods) {
        EnumSet<LeaderboardPeriod> ordered = periods.isEmpty()
                ? EnumSet.noneOf(LeaderboardPeriod.class)
                : EnumSet.copyOf(periods);
        List<ReentrantLock> acquired = new ArrayList<>(ordered.size());
        for (LeaderboardPeriod period : ordered) {
            ReentrantLock lock = locks.get(period);
            lock.lock();
            acquired.add(lock);
        }
        return acquired;
    }

    private boolean releaseAfterTransaction(List<ReentrantLock> acquired) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            return false;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCompletion(int status) {
                release(acquired);
            }
        });
        return true;
    }

    private static void release(List<ReentrantLock> acquired) {
        for (int i = acquired.size() - 1; i >= 0; i--) {
            acquired.get(i).unlock();
        }
    }
}
